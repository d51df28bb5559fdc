package max.chronochess.engine.game;

public enum PlayerState {
    IN_PROGRESS, CHECKMATE, PAT, DRAW
}
