package max.chronochess.engine.movegen.pieces;

import max.chronochess.engine.common.Square;

import java.util.ArrayList;
import java.util.List;

public final class Knight {
    public static final int[][] OFFSETS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    // 1 move list per square
    private static final Square[][] KNIGHT_TARGETS = new Square[64][];

    static {
        generateKnightTargets();
    }

    private Knight() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static Square[] getTargets(Square knightSquare) {
        return KNIGHT_TARGETS[knightSquare.flatIndex];
    }

    private static void generateKnightTargets() {
        for(int i = 0; i < 64; i++) {
            KNIGHT_TARGETS[i] = generateKnightTargetsAt(Square.of(i));
        }
    }

    private static Square[] generateKnightTargetsAt(Square knightSquare) {
        List<Square> targets = new ArrayList<>(8);
        for(int[] offset : OFFSETS) {
            Square target = knightSquare.offset(offset[0], offset[1]);
            if(target != null) {
                targets.add(target);
            }
        }
        return targets.toArray(new Square[0]);
    }
}
