package max.chronochess.engine.movegen.enhanced;

import max.chronochess.engine.ability.AbilityLifecycleManager;
import max.chronochess.engine.ability.ActivityProvider;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.evolution.UpgradeSource;
import max.chronochess.engine.evolution.UpgradeState;
import max.chronochess.engine.game.RulesOracle;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.pieces.Pawn;
import max.chronochess.engine.movegen.utils.CheckUtils;
import max.chronochess.engine.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.IntSupplier;
import java.util.function.LongSupplier;

/**
 * Legal moves of the evolution game: the oracle's moves plus what active abilities and standing
 * effects add, minus anything landing on a king.
 * <p>
 * Moves come out ordered by source square, then oracle order, then ability order. A call made while
 * another one is computing (typically from an {@link ActivityProvider} asking for moves) gets the
 * oracle moves and the cached standing options only.
 */
public class EnhancedMoveGenerator {
    private static final Logger LOGGER = LoggerFactory.getLogger(EnhancedMoveGenerator.class);

    private final RulesOracle oracle;
    private final EvolutionOverlay overlay;
    private final ActivityProvider activity;
    private final UpgradeSource upgrades;
    private final AbilityLifecycleManager lifecycle;
    private final LongSupplier clock;
    private final IntSupplier plies;

    private boolean inFlight;
    private Square dashSquare;

    public EnhancedMoveGenerator(RulesOracle oracle, EvolutionOverlay overlay, ActivityProvider activity,
                                 UpgradeSource upgrades, AbilityLifecycleManager lifecycle,
                                 LongSupplier clock, IntSupplier plies) {
        this.oracle = Objects.requireNonNull(oracle);
        this.overlay = Objects.requireNonNull(overlay);
        this.activity = Objects.requireNonNull(activity);
        this.upgrades = Objects.requireNonNull(upgrades);
        this.lifecycle = Objects.requireNonNull(lifecycle);
        this.clock = Objects.requireNonNull(clock);
        this.plies = Objects.requireNonNull(plies);
    }

    public List<Move> legalMoves() {
        return legalMoves(null);
    }

    /**
     * @param square the piece to generate for, or null for every piece of the side to move
     */
    public List<Move> legalMoves(Square square) {
        if(inFlight) {
            LOGGER.debug("Nested move generation for {}, answering from the cache", square);
            return standingMoves(square);
        }
        inFlight = true;
        try {
            Board board = oracle.board();
            if(square != null) {
                return generate(board, square);
            }
            List<Move> moves = new ArrayList<>();
            for(Square from : piecesToGenerate(board)) {
                moves.addAll(generate(board, from));
            }
            return moves;
        } finally {
            inFlight = false;
        }
    }

    public boolean isInFlight() {
        return inFlight;
    }

    public Square dashSquare() {
        return dashSquare;
    }

    public void openDashWindow(Square square) {
        this.dashSquare = square;
    }

    public void closeDashWindow() {
        this.dashSquare = null;
    }

    public boolean isOracleMove(Move move) {
        if(move.from() == dashSquare) {
            return false;
        }
        for(Move base : oracle.moves(move.from())) {
            if(base.sameSquares(move)) {
                return true;
            }
        }
        return false;
    }

    /** Whether any ability of the piece could ever reach {@code to}, ignoring activity and cooldowns. */
    public boolean isAbilityPattern(Square from, Square to) {
        PieceEvolutionState state = overlay.get(from);
        if(state == null) {
            return false;
        }
        Board board = oracle.board();
        for(AbilityInstance ability : state.abilities) {
            if(EnhancedPatterns.getCandidates(board, from, ability.id, state).contains(to)) {
                return true;
            }
        }
        return state.cachedModifiedMoves.contains(to);
    }

    /** Standard piece geometry from {@code from} to {@code to}, ignoring checks and castling. */
    public boolean isStandardGeometry(Square from, Square to) {
        Board board = oracle.board();
        Piece piece = board.get(from);
        if(piece == null || from == to) {
            return false;
        }
        Piece target = board.get(to);
        if(target != null && target.color() == piece.color()) {
            return false;
        }
        return switch (piece.type()) {
            case PAWN -> isPawnGeometry(board, from, to, piece.color());
            case KING -> from.chebyshevDistance(to) == 1;
            // Sliders and knights move the way they attack
            default -> CheckUtils.getAttackers(board, to, piece.color()).contains(from);
        };
    }

    public boolean leavesKingInCheck(Square from, Square to) {
        Board board = oracle.board();
        Piece piece = board.get(from);
        return piece != null && CheckUtils.wouldKingBeInCheck(board, from, to, piece.color());
    }

    private List<Square> piecesToGenerate(Board board) {
        List<Square> squares = new ArrayList<>(board.occupiedBy(oracle.turn()));
        if(dashSquare != null && !squares.contains(dashSquare)) {
            squares.add(dashSquare);
            squares.sort(null);
        }
        return squares;
    }

    private List<Move> generate(Board board, Square from) {
        Piece piece = board.get(from);
        if(piece == null) {
            return new ArrayList<>();
        }
        if(from == dashSquare) {
            return dashMoves(board, from, piece);
        }
        if(piece.color() != oracle.turn()) {
            return new ArrayList<>();
        }
        List<Move> moves = withoutKingTargets(board, oracle.moves(from));
        PieceEvolutionState state = overlay.get(from);
        if(state == null) {
            return moves;
        }
        if(state.isMoveRestricted) {
            return restrictedMoves(board, from, piece, state, moves);
        }
        if(state.abilities.isEmpty() && state.cachedModifiedMoves.isEmpty()) {
            return moves;
        }

        UpgradeState pieceUpgrades = upgrades.upgradesFor(piece.type(), piece.color());
        long now = clock.getAsLong();
        int currentPly = plies.getAsInt();
        for(AbilityInstance ability : state.abilities) {
            if(!activity.isAbilityActive(ability.id, piece.type(), pieceUpgrades)
                    || !lifecycle.isUsable(ability, now, currentPly)) {
                continue;
            }
            for(Square target : EnhancedPatterns.getCandidates(board, from, ability.id, state)) {
                if(!tagBaseMoves(moves, target, ability.id)) {
                    addEnhancedMoves(board, from, target, piece, ability.id, moves);
                }
            }
        }
        for(Square target : state.cachedModifiedMoves) {
            if(!containsTarget(moves, target)) {
                addEnhancedMoves(board, from, target, piece, Move.MODIFIED_TAG, moves);
            }
        }
        return moves;
    }

    private List<Move> restrictedMoves(Board board, Square from, Piece piece, PieceEvolutionState state, List<Move> baseMoves) {
        List<Move> moves = new ArrayList<>();
        for(Move move : baseMoves) {
            if(state.cachedModifiedMoves.contains(move.to())) {
                moves.add(move.withEnhancedBy(Move.MODIFIED_TAG));
            }
        }
        for(Square target : state.cachedModifiedMoves) {
            if(!containsTarget(moves, target)) {
                addEnhancedMoves(board, from, target, piece, Move.MODIFIED_TAG, moves);
            }
        }
        return moves;
    }

    private List<Move> dashMoves(Board board, Square from, Piece piece) {
        List<Move> moves = new ArrayList<>();
        for(Square target : EnhancedPatterns.getKnightDashTargets(from)) {
            addEnhancedMoves(board, from, target, piece, Move.MODIFIED_TAG, moves);
        }
        return moves;
    }

    /** Answer to nested calls: oracle moves plus standing options, no activity checks. */
    private List<Move> standingMoves(Square square) {
        Board board = oracle.board();
        List<Square> squares = square == null ? piecesToGenerate(board) : List.of(square);
        List<Move> moves = new ArrayList<>();
        for(Square from : squares) {
            Piece piece = board.get(from);
            if(piece == null || (piece.color() != oracle.turn() && from != dashSquare)) {
                continue;
            }
            List<Move> pieceMoves = from == dashSquare ? new ArrayList<>() : withoutKingTargets(board, oracle.moves(from));
            PieceEvolutionState state = overlay.get(from);
            if(state != null) {
                for(Square target : state.cachedModifiedMoves) {
                    if(!containsTarget(pieceMoves, target)) {
                        addEnhancedMoves(board, from, target, piece, Move.MODIFIED_TAG, pieceMoves);
                    }
                }
            }
            moves.addAll(pieceMoves);
        }
        return moves;
    }

    private static boolean tagBaseMoves(List<Move> moves, Square target, String abilityId) {
        boolean found = false;
        for(int i = 0; i < moves.size(); i++) {
            Move move = moves.get(i);
            if(move.to() != target) {
                continue;
            }
            found = true;
            if(!move.isEnhanced()) {
                moves.set(i, move.withEnhancedBy(abilityId));
            }
        }
        return found;
    }

    private static boolean containsTarget(List<Move> moves, Square target) {
        for(Move move : moves) {
            if(move.to() == target) {
                return true;
            }
        }
        return false;
    }

    private static void addEnhancedMoves(Board board, Square from, Square to, Piece piece, String tag, List<Move> moves) {
        Piece occupant = board.get(to);
        if(to == from || occupant != null && (occupant.color() == piece.color() || occupant.type() == PieceType.KING)) {
            return;
        }
        // A pawn on its own back rank is not a legal position
        if(piece.type() == PieceType.PAWN && to.rank == piece.color().backRank()) {
            return;
        }
        if(containsTarget(moves, to) || CheckUtils.wouldKingBeInCheck(board, from, to, piece.color())) {
            return;
        }
        PieceType captured = occupant == null ? null : occupant.type();
        String flags = captured == null ? String.valueOf(Move.NORMAL) : String.valueOf(Move.CAPTURE);
        if(EnhancedPatterns.isPawnOnPromotionSquare(piece.type(), piece.color(), to)) {
            for(PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(enhancedMove(from, to, promotion, piece, captured, flags + Move.PROMOTION, tag));
            }
        } else {
            moves.add(enhancedMove(from, to, null, piece, captured, flags, tag));
        }
    }

    private static Move enhancedMove(Square from, Square to, PieceType promotion, Piece piece, PieceType captured,
                                     String flags, String tag) {
        Move move = new Move(from, to, promotion, piece.type(), captured, null, flags, tag, null, List.of());
        return move.withSan(MoveIOUtils.writeEnhancedNotation(move));
    }

    private static List<Move> withoutKingTargets(Board board, List<Move> moves) {
        List<Move> filtered = new ArrayList<>(moves.size());
        for(Move move : moves) {
            Piece occupant = board.get(move.to());
            if(occupant == null || occupant.type() != PieceType.KING) {
                filtered.add(move);
            }
        }
        return filtered;
    }

    private static boolean isPawnGeometry(Board board, Square from, Square to, Color color) {
        Square ahead = from.offset(0, color.forward());
        if(to == ahead) {
            return board.isEmpty(to);
        }
        if(ahead != null && Pawn.isOnStartRank(from, color) && to == ahead.offset(0, color.forward())) {
            return board.isEmpty(ahead) && board.isEmpty(to);
        }
        for(Square attacked : Pawn.getAttackTargets(from, color)) {
            if(attacked == to) {
                return board.get(to) != null;
            }
        }
        return false;
    }
}
