package max.chronochess.engine.evolution;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.PieceType;

/**
 * Read-only view of the upgrades a player has funded, per piece type.
 */
@FunctionalInterface
public interface UpgradeSource {
    UpgradeSource NONE = (pieceType, color) -> UpgradeState.NONE;

    UpgradeState upgradesFor(PieceType pieceType, Color color);
}
