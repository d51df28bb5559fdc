package max.chronochess.engine.ability;

import max.chronochess.engine.common.Square;

/**
 * Decides, outside the engine, whether an ability fires this turn. Any randomness (a dash chance
 * for instance) belongs to the caller's implementation.
 */
@FunctionalInterface
public interface TriggerPolicy {
    TriggerPolicy ALWAYS = (abilityId, square) -> true;
    TriggerPolicy NEVER = (abilityId, square) -> false;

    boolean fires(String abilityId, Square square);
}
