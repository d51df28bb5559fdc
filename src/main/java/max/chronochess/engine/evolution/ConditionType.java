package max.chronochess.engine.evolution;

public enum ConditionType {
    MOVE_COUNT, PIECE_COUNT, BOARD_POSITION, TIME_ELAPSED
}
