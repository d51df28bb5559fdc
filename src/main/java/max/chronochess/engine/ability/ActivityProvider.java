package max.chronochess.engine.ability;

import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.evolution.AbilityCatalog;
import max.chronochess.engine.evolution.UpgradeState;

/**
 * Tells whether the player has unlocked and funded an ability. Implementations must be pure
 * queries: no side effects and no calls back into the engine.
 */
@FunctionalInterface
public interface ActivityProvider {
    ActivityProvider ALL_ACTIVE = (abilityId, pieceType, upgrades) -> true;
    ActivityProvider NONE_ACTIVE = (abilityId, pieceType, upgrades) -> false;

    boolean isAbilityActive(String abilityId, PieceType pieceType, UpgradeState upgrades);

    /** Active when the upgrade thresholds of the piece type unlock the ability. */
    static ActivityProvider fromUpgrades() {
        return AbilityCatalog::isUnlocked;
    }
}
