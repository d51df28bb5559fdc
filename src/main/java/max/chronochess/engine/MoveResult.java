package max.chronochess.engine;

import max.chronochess.engine.movegen.Move;

/**
 * Outcome of a move request. Exactly one of {@code move} and {@code error} is set.
 */
public record MoveResult(boolean success, Move move, MoveError error, String reason) {
    public static MoveResult ok(Move move) {
        return new MoveResult(true, move, null, null);
    }

    public static MoveResult failure(MoveError error, String reason) {
        return new MoveResult(false, null, error, reason);
    }

    public MoveResult withMove(Move newMove) {
        return new MoveResult(success, newMove, error, reason);
    }

    @Override
    public String toString() {
        return success ? "ok " + move : error + " (" + reason + ")";
    }
}
