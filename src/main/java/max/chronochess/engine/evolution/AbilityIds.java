package max.chronochess.engine.evolution;

import java.util.Set;

public final class AbilityIds {
    private AbilityIds() {
    }

    // Movement
    public static final String ENHANCED_MARCH = "enhanced-march";
    public static final String BREAKTHROUGH = "breakthrough";
    public static final String DIAGONAL_MOVE = "diagonal-move";
    public static final String EXTENDED_RANGE = "extended-range";
    public static final String PHASE_THROUGH = "phase-through";

    // Capture
    public static final String ENHANCED_CAPTURE = "enhanced-capture";
    public static final String GIANT_SLAYER = "giant-slayer";
    public static final String FIRST_STRIKE = "first-strike";
    public static final String CHAIN_CAPTURE = "chain-capture";

    // Special
    public static final String KNIGHT_DASH = "knight-dash";
    public static final String ROOK_ENTRENCH = "rook-entrench";
    public static final String BISHOP_CONSECRATE = "bishop-consecrate";
    public static final String QUEEN_DOMINANCE = "queen-dominance";
    public static final String ROYAL_DECREE = "royal-decree";
    public static final String LAST_STAND = "last-stand";
    public static final String TELEPORT = "teleport";
    public static final String ZONE_CONTROL = "zone-control";
    public static final String PROTECTIVE_AURA = "protective-aura";
    public static final String IMMOBILIZE_RESIST = "immobilize-resist";
    public static final String BERSERKER_RAGE = "berserker-rage";
    public static final String BACKSTAB = "backstab";
    public static final String HEAL_ALLIES = "heal-allies";
    public static final String TIME_WARD = "time-ward";
    public static final String COMMAND_AURA = "command-aura";
    public static final String PREDICT_MOVES = "predict-moves";
    public static final String ENHANCED_VISION = "enhanced-vision";
    public static final String AREA_STRIKE = "area-strike";
    public static final String RESILIENT_STANCE = "resilient-stance";
    public static final String BATTLEFIELD_COMMAND = "battlefield-command";
    public static final String STEALTH_MODE = "stealth-mode";
    public static final String DIVINE_INTERVENTION = "divine-intervention";
    public static final String DIVINE_AUTHORITY = "divine-authority";
    public static final String IMPERIAL_GUARD = "imperial-guard";
    public static final String DIVINE_PROTECTION = "divine-protection";

    // Passive
    public static final String FORTRESS_DEFENSE = "fortress-defense";
    public static final String MANA_REGENERATION = "mana-regeneration";

    /** Abilities that only fire from {@code checkStationaryTriggers}, never on a move. */
    public static final Set<String> STATIONARY = Set.of(ROOK_ENTRENCH, BISHOP_CONSECRATE);
}
