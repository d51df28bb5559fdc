package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Square;

public enum BoardRegion {
    // d4, d5, e4, e5
    CENTER,
    EDGE,
    BACK_RANK;

    public boolean contains(Square square) {
        return switch (this) {
            case CENTER -> square.file >= 3 && square.file <= 4 && square.rank >= 3 && square.rank <= 4;
            case EDGE -> square.file == 0 || square.file == 7 || square.rank == 0 || square.rank == 7;
            case BACK_RANK -> square.rank == 0 || square.rank == 7;
        };
    }
}
