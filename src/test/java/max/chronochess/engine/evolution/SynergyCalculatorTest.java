package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SynergyCalculatorTest {

    private static PieceEvolutionState state(Color color, int level) {
        PieceEvolutionState state = new PieceEvolutionState(PieceType.KNIGHT, color);
        state.evolutionLevel = level;
        return state;
    }

    @Test
    public void synergiesShouldFollowTheAverageLevel() {
        // Given
        EvolutionOverlay overlay = new EvolutionOverlay();
        overlay.put(Square.parse("b1"), state(Color.WHITE, 6));
        overlay.put(Square.parse("g1"), state(Color.WHITE, 4));
        overlay.put(Square.parse("b8"), state(Color.BLACK, 3));
        overlay.put(Square.parse("g8"), state(Color.BLACK, 2));

        // When
        List<Synergy> synergies = SynergyCalculator.calculateBoardSynergies(overlay);

        // Then
        assertEquals(1, synergies.size());
        assertEquals(Color.WHITE, synergies.get(0).color());
        assertEquals(0.1, synergies.get(0).bonus(), 1e-9);
    }

    @Test
    public void emptyOverlayShouldHaveNoSynergy() {
        assertTrue(SynergyCalculator.calculateBoardSynergies(new EvolutionOverlay()).isEmpty());
    }
}
