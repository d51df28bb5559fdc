package max.chronochess.engine.common;

/**
 * A board square, file 0-7 (a-h) by rank 0-7 (1-8).
 * Instances are cached so identity comparison is safe.
 */
public final class Square implements Comparable<Square> {
    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int i = 0; i < 64; i++) {
            SQUARE_CACHE[i] = new Square(i % 8, i / 8);
        }
    }

    public static final Square[] ALL = SQUARE_CACHE.clone();

    public final int file;
    public final int rank;
    public final int flatIndex;
    private final String algebraic;

    private Square(int file, int rank) {
        this.file = file;
        this.rank = rank;
        this.flatIndex = file + 8 * rank;
        this.algebraic = "" + (char) ('a' + file) + (char) ('1' + rank);
    }

    public static boolean isOnBoard(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    /** Returns null when the coordinates fall outside the board. */
    public static Square of(int file, int rank) {
        if(!isOnBoard(file, rank)) {
            return null;
        }
        return SQUARE_CACHE[file + 8 * rank];
    }

    public static Square of(int flatIndex) {
        return SQUARE_CACHE[flatIndex];
    }

    /** Parses algebraic text such as "e4"; returns null when it is not a square. */
    public static Square parse(String text) {
        if(text == null || text.length() != 2) {
            return null;
        }
        int file = Character.toLowerCase(text.charAt(0)) - 'a';
        int rank = text.charAt(1) - '1';
        return of(file, rank);
    }

    public Square offset(int fileDelta, int rankDelta) {
        return of(file + fileDelta, rank + rankDelta);
    }

    public int chebyshevDistance(Square other) {
        return Math.max(Math.abs(file - other.file), Math.abs(rank - other.rank));
    }

    public boolean isLightSquare() {
        return (file + rank) % 2 == 1;
    }

    @Override
    public int compareTo(Square other) {
        return Integer.compare(flatIndex, other.flatIndex);
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return flatIndex;
    }

    @Override
    public String toString() {
        return algebraic;
    }
}
