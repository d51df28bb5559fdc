package max.chronochess.engine.ability;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.game.RulesOracle;
import max.chronochess.engine.game.board.Board;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything an effect may read or touch: the position after the move, the overlay and the acting
 * piece's square.
 *
 * @param firstCapture           the move is the first capture of the game
 * @param previousMoveWasCapture the move before it was a capture
 */
public record EffectContext(Board board,
                            EvolutionOverlay overlay,
                            RulesOracle oracle,
                            EngineConfig config,
                            Square square,
                            int currentPly,
                            boolean firstCapture,
                            boolean previousMoveWasCapture) {

    /** Squares within {@code radius} of the acting piece holding a piece of the given side, in index order. */
    public List<Square> piecesWithin(int radius, boolean allies) {
        Piece self = board.get(square);
        List<Square> squares = new ArrayList<>();
        if(self == null) {
            return squares;
        }
        for(Square other : board.occupied()) {
            if(other == square || other.chebyshevDistance(square) > radius) {
                continue;
            }
            boolean sameSide = board.get(other).color() == self.color();
            if(sameSide == allies) {
                squares.add(other);
            }
        }
        return squares;
    }

    /** The overlay entry of the piece on {@code target}, created on first use. */
    public PieceEvolutionState stateAt(Square target) {
        PieceEvolutionState state = overlay.get(target);
        if(state == null) {
            Piece piece = board.get(target);
            state = new PieceEvolutionState(piece.type(), piece.color());
            overlay.put(target, state);
        }
        return state;
    }
}
