package max.chronochess.engine.utils.notations;

public class InvalidFenException extends IllegalArgumentException {
    public InvalidFenException(String fen, String reason) {
        super("Invalid FEN record '" + fen + "': " + reason);
    }
}
