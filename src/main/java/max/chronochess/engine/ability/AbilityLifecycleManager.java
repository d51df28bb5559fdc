package max.chronochess.engine.ability;

import max.chronochess.engine.evolution.AbilityCondition;
import max.chronochess.engine.evolution.AbilityInstance;
import max.chronochess.engine.evolution.ConditionType;
import max.chronochess.engine.evolution.PieceEvolutionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cooldown, usage and condition gating of abilities.
 * <p>
 * An ability leaves Idle for Usable only when every gate passes: the wall-clock cooldown (if
 * set), the ply cooldown (if set) and the use cap (if set). {@link #canTrigger} also requires its
 * declared conditions to hold. {@link #stamp} records a trigger.
 */
public final class AbilityLifecycleManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbilityLifecycleManager.class);

    public boolean isOnWallClockCooldown(AbilityInstance ability, long now) {
        if(!ability.hasWallClockCooldown() || ability.lastUsedAt() == AbilityInstance.NEVER_USED) {
            return false;
        }
        return now - ability.lastUsedAt() < cooldownMillis(ability);
    }

    public boolean isOnPlyCooldown(AbilityInstance ability, int currentPly) {
        if(!ability.hasPlyCooldown() || ability.lastUsedAtPly() == AbilityInstance.NEVER_USED_PLY) {
            return false;
        }
        return currentPly - ability.lastUsedAtPly() < ability.moveCooldownPlies;
    }

    /** Cooldown and use-cap gates, without conditions. */
    public boolean isUsable(AbilityInstance ability, long now, int currentPly) {
        return !ability.isExhausted()
                && !isOnWallClockCooldown(ability, now)
                && !isOnPlyCooldown(ability, currentPly);
    }

    public boolean canTrigger(AbilityInstance ability, TriggerContext context) {
        if(!isUsable(ability, context.now(), context.currentPly())) {
            return false;
        }
        for(AbilityCondition condition : ability.conditions) {
            if(!isSatisfied(condition, context)) {
                return false;
            }
        }
        return true;
    }

    public boolean isSatisfied(AbilityCondition condition, TriggerContext context) {
        if(condition.type() == ConditionType.BOARD_POSITION) {
            return context.square() != null && condition.region().contains(context.square());
        }
        double value = switch (condition.type()) {
            case MOVE_COUNT -> context.moveCount();
            case PIECE_COUNT -> context.pieceCount();
            case TIME_ELAPSED -> context.elapsedSeconds();
            case BOARD_POSITION -> throw new IllegalStateException("handled above");
        };
        return condition.operator().test(value, condition.threshold());
    }

    /** Records exactly one trigger, free abilities included. */
    public void stamp(AbilityInstance ability, TriggerContext context) {
        ability.stamp(context.now(), context.currentPly());
        LOGGER.debug("Stamped {} at ply {} on {}", ability, context.currentPly(), context.square());
    }

    public CooldownStatus getCooldownStatus(AbilityInstance ability, long now, int currentPly) {
        double remainingSeconds = 0;
        if(isOnWallClockCooldown(ability, now)) {
            remainingSeconds = (cooldownMillis(ability) - (now - ability.lastUsedAt())) / 1000.0;
        }
        int remainingPlies = 0;
        if(isOnPlyCooldown(ability, currentPly)) {
            remainingPlies = ability.moveCooldownPlies - (currentPly - ability.lastUsedAtPly());
        }
        int usesLeft = ability.isCapped() ? Math.max(0, ability.maxUses - ability.usesSoFar()) : -1;
        return new CooldownStatus(ability.id, remainingSeconds, ability.cooldownSeconds,
                remainingPlies, ability.moveCooldownPlies, usesLeft);
    }

    public Map<String, CooldownStatus> getCooldowns(PieceEvolutionState state, long now, int currentPly) {
        Map<String, CooldownStatus> cooldowns = new LinkedHashMap<>();
        for(AbilityInstance ability : state.abilities) {
            cooldowns.put(ability.id, getCooldownStatus(ability, now, currentPly));
        }
        return cooldowns;
    }

    public void resetCooldowns(PieceEvolutionState state) {
        for(AbilityInstance ability : state.abilities) {
            ability.resetCooldown();
        }
    }

    private static long cooldownMillis(AbilityInstance ability) {
        return Math.round(ability.cooldownSeconds * 1000);
    }
}
