package max.chronochess.engine.ability;

/**
 * @param usesLeft remaining uses, or -1 when unlimited
 */
public record CooldownStatus(String abilityId, double remainingSeconds, double totalSeconds,
                             int remainingPlies, int totalPlies, int usesLeft) {
    public boolean isReady() {
        return remainingSeconds <= 0 && remainingPlies <= 0 && usesLeft != 0;
    }
}
