package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Color;

public record Synergy(Color color, double bonus, String description) {
}
