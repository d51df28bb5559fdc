package max.chronochess.engine.movegen.enhanced;

import max.chronochess.engine.EngineConfig;
import max.chronochess.engine.ability.AbilityLifecycleManager;
import max.chronochess.engine.ability.ActivityProvider;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityCatalog;
import max.chronochess.engine.evolution.AbilityIds;
import max.chronochess.engine.evolution.EvolutionOverlay;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.evolution.UpgradeSource;
import max.chronochess.engine.game.StandardRulesOracle;
import max.chronochess.engine.movegen.Move;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class EnhancedMoveGeneratorTest {
    private final AbilityCatalog catalog = new AbilityCatalog(EngineConfig.defaults());
    private final EvolutionOverlay overlay = new EvolutionOverlay();
    private final StandardRulesOracle oracle = new StandardRulesOracle();

    private EnhancedMoveGenerator generator(ActivityProvider activity) {
        return new EnhancedMoveGenerator(oracle, overlay, activity, UpgradeSource.NONE,
                new AbilityLifecycleManager(), () -> 0L, () -> 0);
    }

    private PieceEvolutionState evolve(Square square, PieceType pieceType, String... abilityIds) {
        PieceEvolutionState state = new PieceEvolutionState(pieceType, oracle.get(square).color());
        for(String abilityId : abilityIds) {
            state.putAbility(catalog.createAbility(abilityId));
        }
        overlay.put(square, state);
        return state;
    }

    private static Optional<Move> moveTo(List<Move> moves, String to) {
        return moves.stream().filter(move -> move.to() == Square.parse(to)).findFirst();
    }

    @Test
    public void pieceWithoutEvolutionShouldGetTheOracleMoves() {
        // Given
        assertTrue(oracle.load("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"));

        // When
        List<Move> moves = generator(ActivityProvider.ALL_ACTIVE).legalMoves();

        // Then
        assertEquals(6, moves.size());
        assertTrue(moves.stream().noneMatch(Move::isEnhanced));
    }

    @Test
    public void abilityTargetsAlreadyReachableShouldOnlyBeTagged() {
        // Given
        assertTrue(oracle.load("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"));
        evolve(Square.parse("e2"), PieceType.PAWN, AbilityIds.ENHANCED_MARCH);

        // When
        List<Move> moves = generator(ActivityProvider.ALL_ACTIVE).legalMoves(Square.parse("e2"));

        // Then
        assertEquals(2, moves.size());
        assertTrue(moves.stream().allMatch(move -> AbilityIds.ENHANCED_MARCH.equals(move.enhancedBy())));
    }

    @Test
    public void inactiveAbilitiesShouldAddNothing() {
        // Given
        assertTrue(oracle.load("4k3/7p/8/8/8/8/7P/1N2K3 w - - 0 1"));
        evolve(Square.parse("b1"), PieceType.KNIGHT, AbilityIds.KNIGHT_DASH);

        // When
        List<Move> inactive = generator(ActivityProvider.NONE_ACTIVE).legalMoves(Square.parse("b1"));
        List<Move> active = generator(ActivityProvider.ALL_ACTIVE).legalMoves(Square.parse("b1"));

        // Then
        assertEquals(3, inactive.size());
        assertEquals(11, active.size());
        assertTrue(moveTo(active, "c5").isPresent());
    }

    @Test
    public void abilityMovesShouldNeverLandOnAKing() {
        // Given
        assertTrue(oracle.load("k7/p7/8/8/8/8/8/R3K3 w - - 0 1"));
        PieceEvolutionState state = evolve(Square.parse("a1"), PieceType.ROOK, AbilityIds.ROOK_ENTRENCH);
        state.isEntrenched = true;

        // When
        List<Move> moves = generator(ActivityProvider.ALL_ACTIVE).legalMoves(Square.parse("a1"));

        // Then
        assertFalse(moveTo(moves, "a8").isPresent());
        assertFalse(moveTo(moves, "e1").isPresent());
        Move jump = moveTo(moves, "h1").orElseThrow();
        assertEquals(AbilityIds.ROOK_ENTRENCH, jump.enhancedBy());
        Move capture = moveTo(moves, "a7").orElseThrow();
        assertTrue(capture.isCapture());
        assertEquals(AbilityIds.ROOK_ENTRENCH, capture.enhancedBy());
    }

    @Test
    public void restrictedPieceShouldOnlyKeepItsCachedMoves() {
        // Given
        assertTrue(oracle.load("4k3/8/8/8/8/8/8/R3K3 w - - 0 1"));
        PieceEvolutionState state = evolve(Square.parse("a1"), PieceType.ROOK);
        state.isMoveRestricted = true;
        state.cachedModifiedMoves.add(Square.parse("a4"));
        state.cachedModifiedMoves.add(Square.parse("c1"));

        // When
        List<Move> moves = generator(ActivityProvider.ALL_ACTIVE).legalMoves(Square.parse("a1"));

        // Then
        assertEquals(2, moves.size());
        assertTrue(moves.stream().allMatch(move -> Move.MODIFIED_TAG.equals(move.enhancedBy())));
    }

    @Test
    public void nestedCallsShouldAnswerWithStandingMoves() {
        // Given
        assertTrue(oracle.load("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1"));
        evolve(Square.parse("e2"), PieceType.PAWN, AbilityIds.ENHANCED_MARCH);
        EnhancedMoveGenerator[] holder = new EnhancedMoveGenerator[1];
        List<Integer> nestedSizes = new ArrayList<>();
        List<Boolean> nestedInFlight = new ArrayList<>();
        holder[0] = generator((abilityId, pieceType, upgrades) -> {
            nestedInFlight.add(holder[0].isInFlight());
            nestedSizes.add(holder[0].legalMoves().size());
            return true;
        });

        // When
        List<Move> moves = holder[0].legalMoves();

        // Then
        assertEquals(List.of(6), nestedSizes);
        assertEquals(List.of(true), nestedInFlight);
        assertFalse(holder[0].isInFlight());
        assertEquals(6, moves.size());
        assertEquals(2, moves.stream().filter(Move::isEnhanced).count());
    }

    @Test
    public void dashWindowShouldHandTheKnightToTheWaitingSide() {
        // Given
        assertTrue(oracle.load("4k3/7p/8/8/8/4N3/7P/4K3 b - - 1 1"));
        EnhancedMoveGenerator generator = generator(ActivityProvider.ALL_ACTIVE);

        // When
        generator.openDashWindow(Square.parse("e3"));
        List<Move> duringWindow = generator.legalMoves(Square.parse("e3"));
        generator.closeDashWindow();
        List<Move> afterWindow = generator.legalMoves(Square.parse("e3"));

        // Then
        assertFalse(duringWindow.isEmpty());
        assertTrue(duringWindow.stream().allMatch(move -> Move.MODIFIED_TAG.equals(move.enhancedBy())));
        assertTrue(afterWindow.isEmpty());
        assertEquals(Color.WHITE, oracle.get(Square.parse("e3")).color());
    }
}
