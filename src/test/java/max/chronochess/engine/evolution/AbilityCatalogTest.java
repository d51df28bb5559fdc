package max.chronochess.engine.evolution;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.common.PieceType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class AbilityCatalogTest {
    private final AbilityCatalog catalog = new AbilityCatalog(EngineConfig.defaults());

    private static List<String> ids(List<AbilityInstance> abilities) {
        return abilities.stream().map(ability -> ability.id).collect(Collectors.toList());
    }

    @Test
    public void defaultUpgradesShouldUnlockNothing() {
        for(PieceType pieceType : PieceType.values()) {
            assertTrue(catalog.generateAbilitiesFromEvolution(pieceType, UpgradeState.NONE).isEmpty(), pieceType.name());
            assertEquals(1, AbilityCatalog.calculateEvolutionLevel(pieceType, UpgradeState.NONE), pieceType.name());
        }
    }

    @Test
    public void pawnUpgradesShouldUnlockMarchAndBreakthrough() {
        // Given
        UpgradeState upgrades = UpgradeState.of(Map.of(UpgradeState.MARCH_SPEED, 2.0, UpgradeState.RESILIENCE, 1.0));

        // When
        List<AbilityInstance> abilities = catalog.generateAbilitiesFromEvolution(PieceType.PAWN, upgrades);

        // Then
        assertEquals(List.of(AbilityIds.ENHANCED_MARCH, AbilityIds.BREAKTHROUGH), ids(abilities));
        AbilityInstance march = abilities.get(0);
        assertEquals(AbilityCategory.MOVEMENT, march.category);
        assertEquals(4, march.moveCooldownPlies);
        assertEquals(3, march.maxUses);
        assertEquals(3, AbilityCatalog.calculateEvolutionLevel(PieceType.PAWN, upgrades));
    }

    @Test
    public void knightDashShouldUseTheConfiguredCooldown() {
        // Given
        UpgradeState upgrades = UpgradeState.NONE.with(UpgradeState.DASH_CHANCE, 0.2);

        // When
        List<AbilityInstance> abilities = catalog.generateAbilitiesFromEvolution(PieceType.KNIGHT, upgrades);

        // Then
        assertEquals(1, abilities.size());
        assertEquals(3.0, abilities.get(0).cooldownSeconds, 1e-9);
        assertEquals(AbilityCategory.SPECIAL, abilities.get(0).category);
        assertEquals(1.5, catalog.createAbility(AbilityIds.KNIGHT_DASH, upgrades.with(UpgradeState.DASH_COOLDOWN, 1.5)).cooldownSeconds, 1e-9);
    }

    @Test
    public void rookAbilitiesShouldFollowEntrenchUpgrades() {
        // Given
        UpgradeState upgrades = UpgradeState.NONE
                .with(UpgradeState.ENTRENCH_THRESHOLD, 2.0)
                .with(UpgradeState.ENTRENCH_POWER, 2.0);

        // When
        List<AbilityInstance> abilities = catalog.generateAbilitiesFromEvolution(PieceType.ROOK, upgrades);

        // Then
        assertEquals(List.of(AbilityIds.ROOK_ENTRENCH, AbilityIds.FORTRESS_DEFENSE), ids(abilities));
        assertEquals(AbilityCategory.PASSIVE, abilities.get(1).category);
        assertEquals(2, catalog.stationaryThreshold(AbilityIds.ROOK_ENTRENCH, upgrades));
        assertEquals(3, catalog.stationaryThreshold(AbilityIds.ROOK_ENTRENCH, UpgradeState.NONE));
        assertEquals(3, AbilityCatalog.calculateEvolutionLevel(PieceType.ROOK, upgrades));
    }

    @Test
    public void lastStandShouldCarryAPieceCountCondition() {
        // Given
        UpgradeState upgrades = UpgradeState.NONE.with(UpgradeState.LAST_STAND_THRESHOLD, 0.25);

        // When
        AbilityInstance lastStand = catalog.createAbility(AbilityIds.LAST_STAND, upgrades);

        // Then
        assertEquals(1, lastStand.conditions.size());
        AbilityCondition condition = lastStand.conditions.get(0);
        assertEquals(ConditionType.PIECE_COUNT, condition.type());
        assertEquals(ConditionOperator.LESS_OR_EQUAL, condition.operator());
        assertEquals(8, condition.threshold(), 1e-9);
    }

    @Test
    public void builtAbilitiesShouldCarryTheirDeclaredCategory() {
        assertEquals(AbilityCategory.MOVEMENT, catalog.createAbility(AbilityIds.ENHANCED_MARCH).category);
        assertEquals(AbilityCategory.MOVEMENT, catalog.createAbility(AbilityIds.BREAKTHROUGH).category);
        assertEquals(AbilityCategory.MOVEMENT, catalog.createAbility(AbilityIds.DIAGONAL_MOVE).category);
        assertEquals(AbilityCategory.MOVEMENT, catalog.createAbility(AbilityIds.EXTENDED_RANGE).category);
        assertEquals(AbilityCategory.CAPTURE, catalog.createAbility(AbilityIds.GIANT_SLAYER).category);
        assertEquals(AbilityCategory.CAPTURE, catalog.createAbility(AbilityIds.CHAIN_CAPTURE).category);
        assertEquals(AbilityCategory.PASSIVE, catalog.createAbility(AbilityIds.MANA_REGENERATION).category);
        assertEquals(AbilityCategory.PASSIVE, catalog.createAbility(AbilityIds.FORTRESS_DEFENSE).category);
        assertEquals(AbilityCategory.SPECIAL, catalog.createAbility(AbilityIds.KNIGHT_DASH).category);
        assertEquals(AbilityCategory.SPECIAL, catalog.createAbility(AbilityIds.TELEPORT).category);
        // Ids the catalog does not describe fall back to the special dispatch table
        AbilityInstance unknown = catalog.createAbility("something-new");
        assertEquals(AbilityCategory.SPECIAL, unknown.category);
        assertEquals("something-new", unknown.name);
    }
}
