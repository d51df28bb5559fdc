package max.chronochess.engine.console;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.EvolutionChessEngine;
import max.chronochess.engine.GameState;
import max.chronochess.engine.MoveResult;
import max.chronochess.engine.ability.AbilityResult;
import max.chronochess.engine.ability.CooldownStatus;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.EvolutionData;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.utils.notations.FENUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Line based text front end to the engine.
 * <pre>
 * position startpos|fen &lt;fen&gt; [moves m1 m2 ...]
 * moves [square]            move &lt;uci&gt;            san &lt;san&gt;
 * fen | state | print       evolve &lt;sq&gt; &lt;abilityId...&gt;
 * trigger &lt;sq&gt; &lt;id&gt;       stationary &lt;sq&gt; &lt;rounds&gt;
 * cooldowns &lt;sq&gt;           setoption name &lt;id&gt; value &lt;x&gt;
 * quit
 * </pre>
 */
public final class EngineConsole {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConsole.class);

    private final BufferedReader in;
    private final PrintWriter out;
    private EngineConfig config;
    private EvolutionChessEngine engine;

    public EngineConsole(EngineConfig config) {
        this(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)), true),
                config);
    }

    public EngineConsole(BufferedReader in, PrintWriter out, EngineConfig config) {
        this.in = Objects.requireNonNull(in);
        this.out = Objects.requireNonNull(out);
        this.config = Objects.requireNonNull(config);
        this.engine = new EvolutionChessEngine(config);
    }

    /** Run the command loop on the current thread until "quit" or end of input. */
    public void run() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (!handle(line)) {
                    break;
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Console input closed: {}", e.getMessage());
        }
    }

    /**
     * Executes one command.
     *
     * @return false when the loop should stop
     */
    public boolean handle(String line) {
        String[] tokens = line.trim().split("\\s+");
        switch (tokens[0]) {
            case "quit" -> {
                return false;
            }
            case "position" -> handlePosition(line);
            case "moves" -> handleMoves(tokens);
            case "move" -> report(tokens.length < 2 ? null : engine.makeMoveFromNotation(tokens[1]));
            case "san" -> report(tokens.length < 2 ? null : engine.makeMoveFromNotation(line.substring(3).trim()));
            case "fen" -> send(engine.getCurrentFen());
            case "state" -> handleState();
            case "print" -> send(engine.getBoard().toAscii());
            case "evolve" -> handleEvolve(tokens);
            case "trigger" -> handleTrigger(tokens);
            case "stationary" -> handleStationary(tokens);
            case "cooldowns" -> handleCooldowns(tokens);
            case "setoption" -> handleSetOption(line);
            default -> send("error unknown command " + tokens[0]);
        }
        return true;
    }

    public EvolutionChessEngine engine() {
        return engine;
    }

    /* -------------------- command handlers -------------------- */

    private void handlePosition(String line) {
        // position [startpos | fen <FEN...>] [moves <m1> <m2> ...]
        String rest = line.substring("position".length()).trim();
        String fen;
        List<String> moves = Collections.emptyList();
        int movesIdx = rest.indexOf("moves");
        String head = movesIdx >= 0 ? rest.substring(0, movesIdx).trim() : rest;
        if (movesIdx >= 0) {
            moves = splitMoves(rest.substring(movesIdx + "moves".length()));
        }
        if (head.startsWith("startpos")) {
            fen = FENUtils.STANDARD_GAME;
        } else if (head.startsWith("fen")) {
            fen = head.substring(3).trim();
        } else {
            send("error expected startpos or fen");
            return;
        }
        engine.reset();
        if (!engine.loadFromFen(fen)) {
            send("error invalid fen");
            return;
        }
        for (String move : moves) {
            MoveResult result = engine.makeMoveFromNotation(move);
            if (!result.success()) {
                send("error " + move + " " + result.error());
                return;
            }
        }
        send("ok");
    }

    private static List<String> splitMoves(String s) {
        if (s.isBlank()) return Collections.emptyList();
        return Arrays.asList(s.trim().split("\\s+"));
    }

    private void handleMoves(String[] tokens) {
        List<Move> moves;
        if (tokens.length > 1) {
            Square square = Square.parse(tokens[1]);
            if (square == null) {
                send("error invalid square " + tokens[1]);
                return;
            }
            moves = engine.getLegalMoves(square);
        } else {
            moves = engine.getLegalMoves();
        }
        List<String> rendered = new ArrayList<>(moves.size());
        for (Move move : moves) {
            rendered.add(move.isEnhanced() ? move.toUci() + "[" + move.enhancedBy() + "]" : move.toUci());
        }
        send("moves " + String.join(" ", rendered));
    }

    private void handleState() {
        GameState state = engine.getGameState();
        send("turn " + state.turn()
                + " check " + state.inCheck()
                + " checkmate " + state.inCheckmate()
                + " stalemate " + state.inStalemate()
                + " draw " + state.isDraw()
                + " plies " + state.plyCount());
    }

    private void handleEvolve(String[] tokens) {
        Square square = tokens.length > 1 ? Square.parse(tokens[1]) : null;
        if (square == null) {
            send("error usage: evolve <square> <abilityId...>");
            return;
        }
        Piece piece = engine.getBoard().get(square);
        if (piece == null) {
            send("error no piece on " + square);
            return;
        }
        List<AbilityInstance> abilities = new ArrayList<>();
        for (int i = 2; i < tokens.length; i++) {
            abilities.add(engine.getAbilityCatalog().createAbility(tokens[i]));
        }
        engine.applyEvolutionEffects(square, new EvolutionData(1 + abilities.size(), abilities, Map.of()));
        send("ok " + square + " " + engine.getPieceEvolutionData(square).abilities);
    }

    private void handleTrigger(String[] tokens) {
        Square square = tokens.length > 2 ? Square.parse(tokens[1]) : null;
        if (square == null) {
            send("error usage: trigger <square> <abilityId>");
            return;
        }
        AbilityResult result = engine.triggerAbility(square, tokens[2]);
        send((result.success() ? "ok " : "failed ") + result.abilityId() + " " + result.description());
    }

    private void handleStationary(String[] tokens) {
        Square square = tokens.length > 2 ? Square.parse(tokens[1]) : null;
        if (square == null) {
            send("error usage: stationary <square> <rounds>");
            return;
        }
        int rounds;
        try {
            rounds = Integer.parseInt(tokens[2]);
        } catch (NumberFormatException e) {
            send("error invalid rounds " + tokens[2]);
            return;
        }
        engine.getStationaryTracker().setTurnsStationary(square, rounds);
        List<AbilityResult> results = engine.checkStationaryTriggers();
        if (results.isEmpty()) {
            send("none");
        }
        for (AbilityResult result : results) {
            send("triggered " + result.abilityId() + " " + result.description());
        }
    }

    private void handleCooldowns(String[] tokens) {
        Square square = tokens.length > 1 ? Square.parse(tokens[1]) : null;
        if (square == null) {
            send("error usage: cooldowns <square>");
            return;
        }
        for (CooldownStatus status : engine.getAbilityCooldowns(square).values()) {
            send("cooldown " + status.abilityId()
                    + " seconds " + status.remainingSeconds()
                    + " plies " + status.remainingPlies()
                    + " uses " + status.usesLeft());
        }
        send("end");
    }

    private void handleSetOption(String line) {
        // Syntax: setoption name <id> [value <x>]
        String rest = line.substring("setoption".length()).trim();
        int nameIdx = rest.indexOf("name");
        if (nameIdx < 0) {
            send("error usage: setoption name <id> value <x>");
            return;
        }
        int valueIdx = rest.indexOf(" value ");
        String name = (valueIdx >= 0 ? rest.substring(nameIdx + 4, valueIdx) : rest.substring(nameIdx + 4)).trim();
        String value = valueIdx >= 0 ? rest.substring(valueIdx + 7).trim() : "";
        try {
            config = config.toBuilder().option(name, value).build();
        } catch (IllegalArgumentException e) {
            send("error " + e.getMessage());
            return;
        }
        // A new configuration means a new engine on the same position
        String fen = engine.getCurrentFen();
        engine = new EvolutionChessEngine(config);
        engine.loadFromFen(fen);
        send("ok " + name + "=" + value);
    }

    private void report(MoveResult result) {
        if (result == null) {
            send("error missing move");
        } else if (result.success()) {
            Move move = result.move();
            StringBuilder line = new StringBuilder("played ").append(move.san());
            for (AbilityResult ability : move.abilities()) {
                line.append(' ').append(ability.abilityId()).append(ability.success() ? "+" : "-");
            }
            send(line.toString());
        } else {
            send("illegal " + result.error() + " " + result.reason());
        }
    }

    private void send(String line) {
        out.println(line);
        out.flush();
    }
}
