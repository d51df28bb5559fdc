package max.chronochess.engine.evolution;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.common.PieceType;

import java.util.ArrayList;
import java.util.List;

import static max.chronochess.engine.evolution.AbilityIds.*;
import static max.chronochess.engine.evolution.UpgradeState.*;

/**
 * Turns upgrade levels into abilities and evolution levels, and builds abilities by id.
 */
public final class AbilityCatalog {
    private final EngineConfig config;

    public AbilityCatalog(EngineConfig config) {
        this.config = config;
    }

    public List<AbilityInstance> generateAbilitiesFromEvolution(PieceType pieceType, UpgradeState upgrades) {
        List<AbilityInstance> abilities = new ArrayList<>();
        switch (pieceType) {
            case PAWN -> {
                if(isUnlocked(ENHANCED_MARCH, pieceType, upgrades)) {
                    abilities.add(createAbility(ENHANCED_MARCH, upgrades));
                }
                if(isUnlocked(BREAKTHROUGH, pieceType, upgrades)) {
                    abilities.add(createAbility(BREAKTHROUGH, upgrades));
                }
            }
            case KNIGHT -> {
                if(isUnlocked(KNIGHT_DASH, pieceType, upgrades)) {
                    abilities.add(createAbility(KNIGHT_DASH, upgrades));
                }
            }
            case BISHOP -> {
                if(isUnlocked(EXTENDED_RANGE, pieceType, upgrades)) {
                    abilities.add(createAbility(EXTENDED_RANGE, upgrades));
                }
                if(isUnlocked(BISHOP_CONSECRATE, pieceType, upgrades)) {
                    abilities.add(createAbility(BISHOP_CONSECRATE, upgrades));
                }
            }
            case ROOK -> {
                if(isUnlocked(ROOK_ENTRENCH, pieceType, upgrades)) {
                    abilities.add(createAbility(ROOK_ENTRENCH, upgrades));
                }
                if(isUnlocked(FORTRESS_DEFENSE, pieceType, upgrades)) {
                    abilities.add(createAbility(FORTRESS_DEFENSE, upgrades));
                }
            }
            case QUEEN -> {
                if(isUnlocked(QUEEN_DOMINANCE, pieceType, upgrades)) {
                    abilities.add(createAbility(QUEEN_DOMINANCE, upgrades));
                }
                if(isUnlocked(MANA_REGENERATION, pieceType, upgrades)) {
                    abilities.add(createAbility(MANA_REGENERATION, upgrades));
                }
            }
            case KING -> {
                if(isUnlocked(ROYAL_DECREE, pieceType, upgrades)) {
                    abilities.add(createAbility(ROYAL_DECREE, upgrades));
                }
                if(isUnlocked(LAST_STAND, pieceType, upgrades)) {
                    abilities.add(createAbility(LAST_STAND, upgrades));
                }
            }
        }
        return abilities;
    }

    /**
     * Whether the upgrades of {@code pieceType} unlock {@code abilityId}. Abilities that no upgrade
     * threshold governs are considered unlocked once attached to a piece.
     */
    public static boolean isUnlocked(String abilityId, PieceType pieceType, UpgradeState upgrades) {
        return switch (abilityId) {
            case ENHANCED_MARCH -> pieceType == PieceType.PAWN && upgrades.get(MARCH_SPEED) > 1;
            case BREAKTHROUGH -> pieceType == PieceType.PAWN && upgrades.get(RESILIENCE) > 0;
            case KNIGHT_DASH -> pieceType == PieceType.KNIGHT && upgrades.get(DASH_CHANCE) > 0.1;
            case EXTENDED_RANGE -> pieceType == PieceType.BISHOP
                    ? upgrades.get(SNIPE_RANGE) > 1
                    : pieceType == PieceType.ROOK || pieceType == PieceType.QUEEN;
            case BISHOP_CONSECRATE -> pieceType == PieceType.BISHOP && upgrades.get(CONSECRATION_TURNS) < 3;
            case ROOK_ENTRENCH -> pieceType == PieceType.ROOK && upgrades.get(ENTRENCH_THRESHOLD) < 3;
            case FORTRESS_DEFENSE -> pieceType == PieceType.ROOK && upgrades.get(ENTRENCH_POWER) > 1;
            case QUEEN_DOMINANCE -> pieceType == PieceType.QUEEN && upgrades.get(DOMINANCE_AURA_RANGE) > 2;
            case MANA_REGENERATION -> pieceType == PieceType.QUEEN && upgrades.get(MANA_REGEN_BONUS) > 0;
            case ROYAL_DECREE -> pieceType == PieceType.KING && upgrades.get(ROYAL_DECREE_USES) > 0;
            case LAST_STAND -> pieceType == PieceType.KING && upgrades.get(LAST_STAND_THRESHOLD) > 0.2;
            default -> true;
        };
    }

    public static int calculateEvolutionLevel(PieceType pieceType, UpgradeState upgrades) {
        int level = 1;
        switch (pieceType) {
            case PAWN -> {
                level += (int) Math.max(0, upgrades.get(MARCH_SPEED) - 1);
                level += (int) Math.max(0, upgrades.get(RESILIENCE));
            }
            case KNIGHT -> {
                level += (int) Math.floor((upgrades.get(DASH_CHANCE) - 0.1) / 0.05 + 1e-9);
                level += (int) Math.max(0, 5 - upgrades.get(DASH_COOLDOWN));
            }
            case BISHOP -> {
                level += (int) Math.max(0, upgrades.get(SNIPE_RANGE) - 1);
                level += (int) Math.max(0, 3 - upgrades.get(CONSECRATION_TURNS));
            }
            case ROOK -> {
                level += (int) Math.max(0, 3 - upgrades.get(ENTRENCH_THRESHOLD));
                level += (int) Math.max(0, upgrades.get(ENTRENCH_POWER) - 1);
            }
            case QUEEN -> {
                level += (int) Math.max(0, upgrades.get(DOMINANCE_AURA_RANGE) - 2);
                level += (int) Math.floor(upgrades.get(MANA_REGEN_BONUS) / 0.1 + 1e-9);
            }
            case KING -> {
                level += (int) Math.max(0, upgrades.get(ROYAL_DECREE_USES));
                level += (int) Math.floor((upgrades.get(LAST_STAND_THRESHOLD) - 0.2) / 0.05 + 1e-9);
            }
        }
        return Math.max(1, level);
    }

    /** Stationary turns needed before {@code abilityId} fires; upgrades can only lower it. */
    public int stationaryThreshold(String abilityId, UpgradeState upgrades) {
        String attribute = switch (abilityId) {
            case ROOK_ENTRENCH -> ENTRENCH_THRESHOLD;
            case BISHOP_CONSECRATE -> CONSECRATION_TURNS;
            default -> null;
        };
        if(attribute == null || !upgrades.isSet(attribute)) {
            return config.stationaryThreshold;
        }
        return Math.max(1, Math.min(config.stationaryThreshold, (int) Math.round(upgrades.get(attribute))));
    }

    public AbilityInstance createAbility(String abilityId) {
        return createAbility(abilityId, UpgradeState.NONE);
    }

    /**
     * The ability with its default gating for this configuration. Ids without an entry here are
     * special abilities.
     */
    public AbilityInstance createAbility(String abilityId, UpgradeState upgrades) {
        AbilityInstance.Builder builder = switch (abilityId) {
            case ENHANCED_MARCH -> movement(abilityId).name("Enhanced March")
                    .description("Can move " + (int) Math.max(2, upgrades.get(MARCH_SPEED)) + " squares forward")
                    .moveCooldownPlies(config.enhancedMarchCooldownPlies)
                    .maxUses(config.enhancedMarchMaxUses);
            case BREAKTHROUGH -> movement(abilityId).name("Breakthrough")
                    .description("Can move diagonally without capturing");
            case DIAGONAL_MOVE -> movement(abilityId).name("Diagonal Move");
            case EXTENDED_RANGE -> movement(abilityId).name("Extended Range")
                    .description("Range increased to " + (int) upgrades.get(SNIPE_RANGE));
            case ENHANCED_CAPTURE, GIANT_SLAYER, FIRST_STRIKE, CHAIN_CAPTURE ->
                    AbilityInstance.builder(abilityId, AbilityCategory.CAPTURE).name(abilityId);
            case KNIGHT_DASH -> special(abilityId).name("Knight Dash")
                    .description(Math.round(upgrades.get(DASH_CHANCE) * 100) + "% chance for additional move")
                    .cooldownSeconds(upgrades.isSet(DASH_COOLDOWN) ? upgrades.get(DASH_COOLDOWN) : config.knightDashCooldownSeconds);
            case BISHOP_CONSECRATE -> special(abilityId).name("Consecration")
                    .description("Consecrates after " + stationaryThreshold(abilityId, upgrades) + " stationary turns");
            case ROOK_ENTRENCH -> special(abilityId).name("Entrenchment")
                    .description("Entrenches after " + stationaryThreshold(abilityId, upgrades) + " stationary turns");
            case FORTRESS_DEFENSE -> passive(abilityId).name("Fortress Defense")
                    .description("+" + Math.round((upgrades.get(ENTRENCH_POWER) - 1) * 100) + "% defensive power");
            case QUEEN_DOMINANCE -> special(abilityId).name("Dominance Aura")
                    .description("Dominates enemies within " + config.dominanceRadius + " squares")
                    .cooldownSeconds(config.queenDominanceCooldownSeconds);
            case MANA_REGENERATION -> passive(abilityId).name("Mana Regeneration")
                    .description("+" + Math.round(upgrades.get(MANA_REGEN_BONUS) * 100) + "% mana generation");
            case ROYAL_DECREE -> special(abilityId).name("Royal Decree")
                    .description("Restricts nearby enemies")
                    .maxUses((int) Math.max(1, upgrades.get(ROYAL_DECREE_USES)));
            case LAST_STAND -> special(abilityId).name("Last Stand")
                    .description("Activates at " + Math.round(upgrades.get(LAST_STAND_THRESHOLD) * 100) + "% material")
                    .conditions(List.of(AbilityCondition.of(ConditionType.PIECE_COUNT, ConditionOperator.LESS_OR_EQUAL,
                            Math.round(32 * upgrades.get(LAST_STAND_THRESHOLD)))));
            default -> special(abilityId).name(abilityId);
        };
        return builder.build();
    }

    private static AbilityInstance.Builder movement(String abilityId) {
        return AbilityInstance.builder(abilityId, AbilityCategory.MOVEMENT);
    }

    private static AbilityInstance.Builder special(String abilityId) {
        return AbilityInstance.builder(abilityId, AbilityCategory.SPECIAL);
    }

    private static AbilityInstance.Builder passive(String abilityId) {
        return AbilityInstance.builder(abilityId, AbilityCategory.PASSIVE);
    }
}
