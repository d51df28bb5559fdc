package max.chronochess.engine.movegen.pieces;

public final class Queen {
    public static final int[][] DIRECTIONS = {
            {1, 0}, {-1, 0}, {0, 1}, {0, -1}, {1, 1}, {1, -1}, {-1, 1}, {-1, -1}
    };

    private Queen() {
    }
}
