package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Color;

import java.util.ArrayList;
import java.util.List;

public final class SynergyCalculator {
    private SynergyCalculator() {
    }

    /** Board-wide bonuses from the average evolution level of each side's evolved pieces. */
    public static List<Synergy> calculateBoardSynergies(EvolutionOverlay overlay) {
        List<Synergy> synergies = new ArrayList<>();
        for(Color color : Color.values()) {
            int totalLevel = 0;
            int pieces = 0;
            for(PieceEvolutionState state : overlay.entries().values()) {
                if(state.color == color) {
                    totalLevel += state.evolutionLevel;
                    pieces++;
                }
            }
            if(pieces == 0) {
                continue;
            }
            double averageLevel = (double) totalLevel / pieces;
            if(averageLevel >= 5) {
                synergies.add(new Synergy(color, 0.1, "High evolution synergy"));
            } else if(averageLevel >= 3) {
                synergies.add(new Synergy(color, 0.05, "Moderate evolution synergy"));
            }
        }
        return synergies;
    }
}
