package max.chronochess.engine.ability;

import max.chronochess.engine.common.Square;

/**
 * What the lifecycle needs to know to gate a trigger.
 *
 * @param moveCount      moves in the engine history
 * @param pieceCount     pieces on the board
 * @param elapsedSeconds seconds since the game started
 */
public record TriggerContext(Square square, long now, int currentPly, int moveCount, int pieceCount, double elapsedSeconds) {
}
