package max.chronochess.engine.movegen.pieces;

import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;

import java.util.ArrayList;
import java.util.List;

public final class SlidingPieces {
    private SlidingPieces() {
    }

    /**
     * Walks each direction until the board edge, stopping on (and including) the first occupied square.
     */
    public static List<Square> getRayTargets(Board board, Square from, int[][] directions) {
        List<Square> targets = new ArrayList<>();
        for(int[] direction : directions) {
            Square current = from.offset(direction[0], direction[1]);
            while(current != null) {
                targets.add(current);
                if(!board.isEmpty(current)) {
                    break;
                }
                current = current.offset(direction[0], direction[1]);
            }
        }
        return targets;
    }

    /**
     * Every square along each direction up to the board edge, ignoring any piece in the way.
     */
    public static List<Square> getUnblockedRayTargets(Square from, int[][] directions) {
        List<Square> targets = new ArrayList<>();
        for(int[] direction : directions) {
            Square current = from.offset(direction[0], direction[1]);
            while(current != null) {
                targets.add(current);
                current = current.offset(direction[0], direction[1]);
            }
        }
        return targets;
    }
}
