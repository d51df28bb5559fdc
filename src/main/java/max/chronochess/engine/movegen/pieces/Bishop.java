package max.chronochess.engine.movegen.pieces;

public final class Bishop {
    public static final int[][] DIRECTIONS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};

    private Bishop() {
    }
}
