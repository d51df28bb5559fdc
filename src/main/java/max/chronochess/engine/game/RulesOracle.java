package max.chronochess.engine.game;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;

import java.util.List;

/**
 * Standard chess rules: legal moves, check and end-of-game detection, FEN in and out.
 * Knows nothing about evolutions.
 */
public interface RulesOracle {
    /** Replaces the position; returns false and keeps the current one when the FEN is rejected. */
    boolean load(String fen);

    /**
     * Replaces the position with one reached from the current position by a move the standard rules
     * do not know. Unlike {@link #load(String)}, the positions seen so far still count toward
     * repetition.
     */
    boolean continueFrom(String fen);

    /** Plays a legal move and returns it with its SAN, or null when it is not legal. */
    Move move(Square from, Square to, PieceType promotion);

    /** Plays the move written in SAN (or long algebraic) notation, or returns null. */
    Move move(String notation);

    List<Move> moves();

    List<Move> moves(Square square);

    /** Legal moves of the piece on {@code square} as if its color were to move. */
    List<Move> movesFor(Square square);

    Piece get(Square square);

    Color turn();

    boolean inCheck();

    boolean isCheckmate();

    boolean isStalemate();

    boolean isDraw();

    boolean isGameOver();

    /** A copy of the board. */
    Board board();

    String fen();

    int halfMoveClock();

    int fullMoveNumber();
}
