package max.chronochess.engine.movegen.pieces;

public final class Rook {
    public static final int[][] DIRECTIONS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private Rook() {
    }
}
