package max.chronochess.engine.elegance;

/**
 * Tactical themes found in a move, with the two multipliers applied to their sum.
 *
 * @param checkmatePattern null when the move does not mate
 */
public record EleganceFactors(CheckmatePattern checkmatePattern,
                              boolean sacrifice,
                              boolean fork,
                              boolean pin,
                              boolean skewer,
                              boolean discoveredAttack,
                              boolean doubleCheck,
                              double moveEfficiency,
                              double tacticalComplexity) {
    public boolean checkmate() {
        return checkmatePattern != null;
    }

    public boolean smotheredMate() {
        return checkmatePattern == CheckmatePattern.SMOTHERED;
    }

    public boolean backRankMate() {
        return checkmatePattern == CheckmatePattern.BACK_RANK;
    }
}
