package max.chronochess.engine.evolution;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Upgrade levels bought for one piece type, e.g. a pawn's march speed or a rook's entrench
 * threshold. Missing attributes read as their untouched default.
 */
public final class UpgradeState {
    public static final String MARCH_SPEED = "marchSpeed";
    public static final String RESILIENCE = "resilience";
    public static final String DASH_CHANCE = "dashChance";
    public static final String DASH_COOLDOWN = "dashCooldown";
    public static final String SNIPE_RANGE = "snipeRange";
    public static final String CONSECRATION_TURNS = "consecrationTurns";
    public static final String ENTRENCH_THRESHOLD = "entrenchThreshold";
    public static final String ENTRENCH_POWER = "entrenchPower";
    public static final String DOMINANCE_AURA_RANGE = "dominanceAuraRange";
    public static final String MANA_REGEN_BONUS = "manaRegenBonus";
    public static final String ROYAL_DECREE_USES = "royalDecreeUses";
    public static final String LAST_STAND_THRESHOLD = "lastStandThreshold";

    private static final Map<String, Double> DEFAULTS = new HashMap<>();
    static {
        DEFAULTS.put(MARCH_SPEED, 1.0);
        DEFAULTS.put(RESILIENCE, 0.0);
        DEFAULTS.put(DASH_CHANCE, 0.1);
        DEFAULTS.put(DASH_COOLDOWN, 5.0);
        DEFAULTS.put(SNIPE_RANGE, 1.0);
        DEFAULTS.put(CONSECRATION_TURNS, 3.0);
        DEFAULTS.put(ENTRENCH_THRESHOLD, 3.0);
        DEFAULTS.put(ENTRENCH_POWER, 1.0);
        DEFAULTS.put(DOMINANCE_AURA_RANGE, 2.0);
        DEFAULTS.put(MANA_REGEN_BONUS, 0.0);
        DEFAULTS.put(ROYAL_DECREE_USES, 0.0);
        DEFAULTS.put(LAST_STAND_THRESHOLD, 0.2);
    }

    public static final UpgradeState NONE = new UpgradeState(Map.of());

    private final Map<String, Double> attributes;

    private UpgradeState(Map<String, Double> attributes) {
        this.attributes = Collections.unmodifiableMap(new TreeMap<>(attributes));
    }

    public static UpgradeState of(Map<String, Double> attributes) {
        return new UpgradeState(attributes);
    }

    public UpgradeState with(String attribute, double value) {
        Map<String, Double> copy = new TreeMap<>(attributes);
        copy.put(attribute, value);
        return new UpgradeState(copy);
    }

    public double get(String attribute) {
        Double value = attributes.get(attribute);
        if(value != null) {
            return value;
        }
        return DEFAULTS.getOrDefault(attribute, 0.0);
    }

    public boolean isSet(String attribute) {
        return attributes.containsKey(attribute);
    }

    public Map<String, Double> attributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof UpgradeState other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "UpgradeState" + attributes;
    }
}
