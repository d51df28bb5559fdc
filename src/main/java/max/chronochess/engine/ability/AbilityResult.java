package max.chronochess.engine.ability;

import java.util.Map;

public record AbilityResult(String abilityId, boolean success, String description, Map<String, Object> effect) {
    public AbilityResult {
        effect = effect == null ? Map.of() : Map.copyOf(effect);
    }

    public static AbilityResult success(String abilityId, String description, Map<String, Object> effect) {
        return new AbilityResult(abilityId, true, description, effect);
    }

    public static AbilityResult failure(String abilityId, String description) {
        return new AbilityResult(abilityId, false, description, Map.of());
    }
}
