package max.chronochess.engine;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.movegen.Move;

import java.util.List;

/**
 * Snapshot of the game as seen from outside. Checkmate, stalemate and draws are reported here, not
 * as move errors.
 */
public record GameState(String fen,
                        Color turn,
                        boolean inCheck,
                        boolean inCheckmate,
                        boolean inStalemate,
                        boolean isDraw,
                        boolean isGameOver,
                        int plyCount,
                        List<Move> moveHistory) {
    public GameState {
        moveHistory = List.copyOf(moveHistory);
    }
}
