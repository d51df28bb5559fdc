package max.chronochess.engine.evolution;

import java.util.List;
import java.util.Map;

/**
 * Evolution handed over by the progression side: a level, the unlocked abilities and named
 * attributes (attackPower, defense, breakthrough, allyBonus, authority) mapped onto multipliers.
 */
public record EvolutionData(int evolutionLevel, List<AbilityInstance> abilities, Map<String, Double> attributes) {
    public static final String ATTACK_POWER = "attackPower";
    public static final String DEFENSE = "defense";
    public static final String BREAKTHROUGH = "breakthrough";
    public static final String ALLY_BONUS = "allyBonus";
    public static final String AUTHORITY = "authority";

    public EvolutionData {
        if(evolutionLevel < 1) {
            throw new IllegalArgumentException("Evolution level must be at least 1");
        }
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
