package max.chronochess.engine.game.board;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Explicit 8x8 board, one optional piece per square indexed by {@link Square#flatIndex}.
 */
public final class Board {
    private final Piece[] squares;

    public Board() {
        this.squares = new Piece[64];
    }

    private Board(Piece[] squares) {
        this.squares = squares;
    }

    public Board copy() {
        return new Board(squares.clone());
    }

    public Piece get(Square square) {
        return squares[square.flatIndex];
    }

    public boolean isEmpty(Square square) {
        return squares[square.flatIndex] == null;
    }

    public void put(Square square, Piece piece) {
        squares[square.flatIndex] = piece;
    }

    public Piece remove(Square square) {
        Piece removed = squares[square.flatIndex];
        squares[square.flatIndex] = null;
        return removed;
    }

    /**
     * Moves the piece at {@code from} to {@code to} on a copy of {@code board}, replacing it by the
     * promoted piece when {@code promotion} is given. The original board is left untouched.
     *
     * @throws IllegalArgumentException when {@code from} is empty
     */
    public static Board applyMoveToBoard(Board board, Square from, Square to, PieceType promotion) {
        Piece moving = board.get(from);
        if(moving == null) {
            throw new IllegalArgumentException("No piece on " + from);
        }
        Board result = board.copy();
        result.remove(from);
        result.put(to, promotion == null ? moving : Piece.of(promotion, moving.color()));
        return result;
    }

    public Square findKing(Color color) {
        for(int i = 0; i < 64; i++) {
            Piece piece = squares[i];
            if(piece != null && piece.is(PieceType.KING, color)) {
                return Square.of(i);
            }
        }
        return null;
    }

    public int count(PieceType pieceType, Color color) {
        int count = 0;
        for(Piece piece : squares) {
            if(piece != null && piece.is(pieceType, color)) {
                count++;
            }
        }
        return count;
    }

    public int pieceCount() {
        int count = 0;
        for(Piece piece : squares) {
            if(piece != null) {
                count++;
            }
        }
        return count;
    }

    /** Squares occupied by {@code color}, in flat index order. */
    public List<Square> occupiedBy(Color color) {
        List<Square> occupied = new ArrayList<>();
        for(int i = 0; i < 64; i++) {
            if(squares[i] != null && squares[i].color() == color) {
                occupied.add(Square.of(i));
            }
        }
        return occupied;
    }

    public List<Square> occupied() {
        List<Square> occupied = new ArrayList<>();
        for(int i = 0; i < 64; i++) {
            if(squares[i] != null) {
                occupied.add(Square.of(i));
            }
        }
        return occupied;
    }

    /** Rows from rank 8 down to rank 1, the way the board is printed. */
    public Piece[][] toRows() {
        Piece[][] rows = new Piece[8][8];
        for(int rank = 7; rank >= 0; rank--) {
            for(int file = 0; file < 8; file++) {
                rows[7 - rank][file] = squares[file + 8 * rank];
            }
        }
        return rows;
    }

    public String toAscii() {
        StringBuilder sb = new StringBuilder();
        for(int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append(' ');
            for(int file = 0; file < 8; file++) {
                Piece piece = squares[file + 8 * rank];
                sb.append(piece == null ? '.' : piece.fenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("  a b c d e f g h");
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) {
            return true;
        }
        if(!(obj instanceof Board other)) {
            return false;
        }
        return Arrays.equals(squares, other.squares);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(squares);
    }

    @Override
    public String toString() {
        return toAscii();
    }
}
