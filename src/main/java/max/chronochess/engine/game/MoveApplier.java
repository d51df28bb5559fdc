package max.chronochess.engine.game;

import max.chronochess.engine.GameState;
import max.chronochess.engine.MoveError;
import max.chronochess.engine.MoveResult;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.enhanced.EnhancedMoveGenerator;
import max.chronochess.engine.movegen.enhanced.EnhancedPatterns;
import max.chronochess.engine.rules.CustomRule;
import max.chronochess.engine.utils.notations.FENUtils;
import max.chronochess.engine.utils.notations.InvalidFenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Validates a move request and commits it to the rules oracle and the evolution overlay.
 * <p>
 * Moves the standard rules know go through the oracle. Anything else is played on a copy of the
 * board, turned into FEN and loaded back. Nothing is committed when a step fails.
 */
public class MoveApplier {
    private static final Logger LOGGER = LoggerFactory.getLogger(MoveApplier.class);

    private final RulesOracle oracle;
    private final EvolutionOverlay overlay;
    private final EnhancedMoveGenerator generator;

    /**
     * @param reconstructed the move was played outside the standard rules
     * @param dash          the move was the follow-up of a knight dash
     */
    public record Outcome(MoveResult result, boolean reconstructed, boolean dash) {
        static Outcome failure(MoveError error, String reason) {
            return new Outcome(MoveResult.failure(error, reason), false, false);
        }
    }

    public MoveApplier(RulesOracle oracle, EvolutionOverlay overlay, EnhancedMoveGenerator generator) {
        this.oracle = oracle;
        this.overlay = overlay;
        this.generator = generator;
    }

    public Outcome apply(Square from, Square to, PieceType promotion, List<CustomRule> rules, Supplier<GameState> state) {
        if(oracle.isGameOver()) {
            return Outcome.failure(MoveError.GAME_OVER, "The game is over");
        }
        Board board = oracle.board();
        Piece target = board.get(to);
        if(target != null && target.type() == PieceType.KING) {
            return Outcome.failure(MoveError.TARGETS_KING, "Kings cannot be captured");
        }
        Piece piece = board.get(from);
        if(piece == null) {
            return Outcome.failure(MoveError.EMPTY_SOURCE, "No piece on " + from);
        }
        boolean dash = from == generator.dashSquare();
        if(!dash && piece.color() != oracle.turn()) {
            return Outcome.failure(MoveError.WRONG_SIDE_TO_MOVE, "It is " + oracle.turn() + "'s turn");
        }

        PieceType wantedPromotion = null;
        if(EnhancedPatterns.isPawnOnPromotionSquare(piece.type(), piece.color(), to)) {
            wantedPromotion = promotion == null ? PieceType.QUEEN : promotion;
        }
        Move requested = Move.standard(from, to, wantedPromotion, piece.type(), target == null ? null : target.type(), null);
        for(CustomRule rule : rules) {
            if(!rule.allows(requested, state.get())) {
                return Outcome.failure(MoveError.CUSTOM_RULE_VIOLATION, "Rejected by rule " + rule.name());
            }
        }

        Move resolved = resolve(generator.legalMoves(from), to, wantedPromotion);
        if(resolved == null) {
            return classifyRejection(from, to);
        }

        boolean reconstructed = dash || !generator.isOracleMove(resolved);
        Move played;
        if(reconstructed) {
            MoveResult result = reconstruct(board, resolved, piece.color(), dash);
            if(!result.success()) {
                return new Outcome(result, true, dash);
            }
            played = result.move();
        } else {
            Move oracleMove = oracle.move(from, to, resolved.promotion());
            if(oracleMove == null) {
                LOGGER.error("Rules oracle refused generated move {}", resolved.toUci());
                return Outcome.failure(MoveError.ENGINE_DESYNC, "Rules oracle refused " + resolved.toUci());
            }
            played = oracleMove.withEnhancedBy(resolved.enhancedBy());
        }
        migrate(played, reconstructed);
        LOGGER.debug("Applied {} ({})", played, reconstructed ? "reconstructed" : "standard");
        return new Outcome(MoveResult.ok(played), reconstructed, dash);
    }

    private static Move resolve(List<Move> legalMoves, Square to, PieceType promotion) {
        for(Move move : legalMoves) {
            if(move.to() == to && move.promotion() == promotion) {
                return move;
            }
        }
        return null;
    }

    private Outcome classifyRejection(Square from, Square to) {
        boolean abilityPattern = generator.isAbilityPattern(from, to);
        if(abilityPattern || generator.isStandardGeometry(from, to)) {
            if(generator.leavesKingInCheck(from, to)) {
                return Outcome.failure(MoveError.LEAVES_KING_IN_CHECK, from + "-" + to + " leaves the king in check");
            }
            if(abilityPattern) {
                return Outcome.failure(MoveError.ABILITY_UNAVAILABLE, "No active ability allows " + from + "-" + to);
            }
        }
        return Outcome.failure(MoveError.ILLEGAL_MOVE, from + "-" + to + " is not legal");
    }

    private MoveResult reconstruct(Board board, Move move, Color mover, boolean dash) {
        Board after;
        try {
            after = Board.applyMoveToBoard(board, move.from(), move.to(), move.promotion());
        } catch (IllegalArgumentException e) {
            LOGGER.error("Source square {} is empty on the board", move.from(), e);
            return MoveResult.failure(MoveError.ENGINE_DESYNC, e.getMessage());
        }

        Game next = FENUtils.getBoardFrom(oracle.fen());
        next.setBoard(after);
        if(!dash) {
            if(mover == Color.BLACK) {
                next.fullMoveClock++;
            }
            next.nextTurn();
        }
        next.halfMoveClock = move.pieceType() == PieceType.PAWN || move.isCapture() ? 0 : next.halfMoveClock + 1;
        next.enPassantSquare = null;
        next.sanitizeCastlingRights();

        String fen = FENUtils.getFENFromBoard(next);
        try {
            FENUtils.validatePosition(next, fen);
        } catch (InvalidFenException e) {
            LOGGER.warn("Reconstructed position rejected: {}", e.getMessage());
            return MoveResult.failure(MoveError.MALFORMED_POSITION, e.getMessage());
        }
        if(!oracle.continueFrom(fen)) {
            return MoveResult.failure(MoveError.MALFORMED_POSITION, "Rules oracle rejected " + fen);
        }
        return MoveResult.ok(move);
    }

    private void migrate(Move move, boolean reconstructed) {
        Square from = move.from();
        Square to = move.to();
        if(move.hasFlag(Move.EN_PASSANT)) {
            overlay.remove(Square.of(to.file, from.rank));
        }
        PieceEvolutionState state = overlay.migrate(from, to);
        if(state != null) {
            if(move.promotion() != null) {
                state.pieceType = move.promotion();
            }
            // Entrenchment and consecration only last while the piece stays put
            state.isEntrenched = false;
            state.isConsecratedSource = false;
            state.territoryControl.clear();
            if(reconstructed && Move.MODIFIED_TAG.equals(move.enhancedBy())) {
                state.teleportCharged = false;
            }
        }
        if(move.isCastling()) {
            int rank = from.rank;
            if(move.hasFlag(Move.KING_SIDE_CASTLE)) {
                overlay.migrate(Square.of(7, rank), Square.of(5, rank));
            } else {
                overlay.migrate(Square.of(0, rank), Square.of(3, rank));
            }
        }
    }
}
