package max.chronochess.engine.movegen.pieces;

import max.chronochess.engine.common.Square;

import java.util.ArrayList;
import java.util.List;

public final class King {
    private static final Square[][] KING_TARGETS = new Square[64][];

    static {
        for(int i = 0; i < 64; i++) {
            KING_TARGETS[i] = generateKingTargetsAt(Square.of(i));
        }
    }

    private King() {
    }

    public static void warmUp() {
        // To init the caches
    }

    public static Square[] getTargets(Square kingSquare) {
        return KING_TARGETS[kingSquare.flatIndex];
    }

    private static Square[] generateKingTargetsAt(Square kingSquare) {
        List<Square> targets = new ArrayList<>(8);
        for(int fileDelta = -1; fileDelta <= 1; fileDelta++) {
            for(int rankDelta = -1; rankDelta <= 1; rankDelta++) {
                if(fileDelta == 0 && rankDelta == 0) {
                    continue;
                }
                Square target = kingSquare.offset(fileDelta, rankDelta);
                if(target != null) {
                    targets.add(target);
                }
            }
        }
        return targets.toArray(new Square[0]);
    }
}
