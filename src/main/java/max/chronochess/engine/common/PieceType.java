package max.chronochess.engine.common;

public enum PieceType {
    PAWN('p', 1), KNIGHT('n', 3), BISHOP('b', 3), ROOK('r', 5), QUEEN('q', 9), KING('k', 0);

    public static final PieceType[] VALUES = PieceType.values();
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    public final char letter;
    // Material value used by elegance scoring and capture bonuses
    public final int value;

    PieceType(char letter, int value) {
        this.letter = letter;
        this.value = value;
    }

    public char sanLetter() {
        return Character.toUpperCase(letter);
    }

    public static PieceType fromLetter(char letter) {
        char lower = Character.toLowerCase(letter);
        for(PieceType pieceType : VALUES) {
            if(pieceType.letter == lower) {
                return pieceType;
            }
        }
        return null;
    }
}
