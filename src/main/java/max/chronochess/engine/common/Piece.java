package max.chronochess.engine.common;

public record Piece(PieceType type, Color color) {
    private static final Piece[] CACHE = new Piece[12];
    static {
        for(PieceType pieceType : PieceType.VALUES) {
            for(Color color : Color.values()) {
                CACHE[cacheIndex(pieceType, color)] = new Piece(pieceType, color);
            }
        }
    }

    public static Piece of(PieceType type, Color color) {
        return CACHE[cacheIndex(type, color)];
    }

    public static Piece fromFenLetter(char letter) {
        PieceType type = PieceType.fromLetter(letter);
        if(type == null) {
            return null;
        }
        return of(type, Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK);
    }

    private static int cacheIndex(PieceType type, Color color) {
        return type.ordinal() * 2 + color.ordinal();
    }

    public char fenLetter() {
        return color == Color.WHITE ? Character.toUpperCase(type.letter) : type.letter;
    }

    public boolean is(PieceType pieceType, Color pieceColor) {
        return type == pieceType && color == pieceColor;
    }
}
