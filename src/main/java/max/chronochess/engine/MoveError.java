package max.chronochess.engine;

public enum MoveError {
    // Invalid input
    INVALID_SQUARE,
    EMPTY_SOURCE,
    INVALID_NOTATION,

    // Illegal move
    WRONG_SIDE_TO_MOVE,
    ILLEGAL_MOVE,
    ABILITY_UNAVAILABLE,
    LEAVES_KING_IN_CHECK,
    TARGETS_KING,
    CUSTOM_RULE_VIOLATION,

    GAME_OVER,

    // The board and the overlay disagree, or a reconstructed position is not playable
    ENGINE_DESYNC,
    MALFORMED_POSITION
}
