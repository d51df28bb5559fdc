package max.chronochess.engine.movegen.pieces;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Square;

public final class Pawn {
    private Pawn() {
    }

    public static int getStartRank(Color color) {
        return color == Color.WHITE ? 1 : 6;
    }

    public static boolean isOnStartRank(Square square, Color color) {
        return square.rank == getStartRank(color);
    }

    public static boolean isPromotionSquare(Square square, Color color) {
        return square.rank == color.promotionRank();
    }

    /** The (at most two) squares a pawn of {@code color} on {@code square} attacks. */
    public static Square[] getAttackTargets(Square square, Color color) {
        Square left = square.offset(-1, color.forward());
        Square right = square.offset(1, color.forward());
        if(left == null && right == null) {
            return new Square[0];
        }
        if(left == null) {
            return new Square[]{right};
        }
        if(right == null) {
            return new Square[]{left};
        }
        return new Square[]{left, right};
    }
}
