package max.chronochess.engine.common;

public enum Color {
    WHITE('w'), BLACK('b');

    public final char fenLetter;

    Color(char fenLetter) {
        this.fenLetter = fenLetter;
    }

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // Rank direction a pawn of this color advances in
    public int forward() {
        return this == WHITE ? 1 : -1;
    }

    public int backRank() {
        return this == WHITE ? 0 : 7;
    }

    public int promotionRank() {
        return this == WHITE ? 7 : 0;
    }

    public static Color fromFen(String letter) {
        return switch (letter) {
            case "w" -> WHITE;
            case "b" -> BLACK;
            default -> null;
        };
    }
}
