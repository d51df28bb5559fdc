package max.chronochess.engine.movegen.enhanced;

import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.game.board.Board;

import java.util.Map;

/**
 * Recomputes the cached destinations that fired effects leave behind. Run after every change to the
 * board or the overlay so that cached squares always match the current position.
 */
public final class StandingOptions {
    private StandingOptions() {
    }

    /**
     * @param dashSquare square of a knight with an open dash window, or null
     */
    public static void refresh(Board board, EvolutionOverlay overlay, Square dashSquare) {
        for(Map.Entry<Square, PieceEvolutionState> entry : overlay.entries().entrySet()) {
            Square square = entry.getKey();
            PieceEvolutionState state = entry.getValue();
            if(state.isMoveRestricted) {
                // The restricted set is fixed when the restriction is applied
                continue;
            }
            state.cachedModifiedMoves.clear();
            if(state.isEntrenched) {
                state.cachedModifiedMoves.addAll(EnhancedPatterns.getEntrenchedRookTargets(square));
            }
            if(state.isConsecratedSource) {
                state.cachedModifiedMoves.addAll(EnhancedPatterns.getConsecratedBishopTargets(square));
            }
            if(state.isReceivingConsecration) {
                if(hasConsecratingAlly(overlay, square, state)) {
                    state.cachedModifiedMoves.addAll(EnhancedPatterns.getConsecrationBonusTargets(board, square, 2));
                } else {
                    state.isReceivingConsecration = false;
                }
            }
            if(state.canMoveThrough) {
                state.cachedModifiedMoves.addAll(EnhancedPatterns.getBreakthroughTargets(board, square, state.color));
            }
            if(state.teleportCharged) {
                state.cachedModifiedMoves.addAll(EnhancedPatterns.getTeleportTargets(board, state.pieceType, state.color));
            }
            if(square == dashSquare) {
                state.cachedModifiedMoves.addAll(EnhancedPatterns.getKnightDashTargets(square));
            }
            state.cachedModifiedMoves.remove(square);
        }
    }

    private static boolean hasConsecratingAlly(EvolutionOverlay overlay, Square square, PieceEvolutionState receiver) {
        for(Map.Entry<Square, PieceEvolutionState> entry : overlay.entries().entrySet()) {
            PieceEvolutionState source = entry.getValue();
            if(source != receiver && source.isConsecratedSource && source.color == receiver.color
                    && entry.getKey().chebyshevDistance(square) <= source.consecrationRadius) {
                return true;
            }
        }
        return false;
    }
}
