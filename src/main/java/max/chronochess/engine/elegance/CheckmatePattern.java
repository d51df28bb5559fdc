package max.chronochess.engine.elegance;

public enum CheckmatePattern {
    SMOTHERED("Smothered Mate", 100),
    BACK_RANK("Back Rank Mate", 25),
    PLAIN("Checkmate", 20);

    public final String displayName;
    public final int score;

    CheckmatePattern(String displayName, int score) {
        this.displayName = displayName;
        this.score = score;
    }
}
