package max.chronochess.engine.movegen.utils;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.pieces.Bishop;
import max.chronochess.engine.movegen.pieces.King;
import max.chronochess.engine.movegen.pieces.Knight;
import max.chronochess.engine.movegen.pieces.Pawn;
import max.chronochess.engine.movegen.pieces.Rook;

import java.util.ArrayList;
import java.util.List;

public final class CheckUtils {
    private CheckUtils() {
    }

    public static boolean isSquareAttacked(Board board, Square square, Color attackerColor) {
        return !getAttackers(board, square, attackerColor, true).isEmpty();
    }

    public static List<Square> getAttackers(Board board, Square square, Color attackerColor) {
        return getAttackers(board, square, attackerColor, false);
    }

    private static List<Square> getAttackers(Board board, Square square, Color attackerColor, boolean stopAtFirst) {
        List<Square> attackers = new ArrayList<>(2);

        // A pawn attacks square if square attacks it back as a pawn of the other color
        for(Square pawnSquare : Pawn.getAttackTargets(square, attackerColor.getOppositeColor())) {
            if(isPiece(board, pawnSquare, PieceType.PAWN, attackerColor)) {
                attackers.add(pawnSquare);
                if(stopAtFirst) return attackers;
            }
        }
        for(Square knightSquare : Knight.getTargets(square)) {
            if(isPiece(board, knightSquare, PieceType.KNIGHT, attackerColor)) {
                attackers.add(knightSquare);
                if(stopAtFirst) return attackers;
            }
        }
        for(Square kingSquare : King.getTargets(square)) {
            if(isPiece(board, kingSquare, PieceType.KING, attackerColor)) {
                attackers.add(kingSquare);
                if(stopAtFirst) return attackers;
            }
        }
        addSliderAttackers(board, square, attackerColor, Rook.DIRECTIONS, PieceType.ROOK, attackers, stopAtFirst);
        if(stopAtFirst && !attackers.isEmpty()) return attackers;
        addSliderAttackers(board, square, attackerColor, Bishop.DIRECTIONS, PieceType.BISHOP, attackers, stopAtFirst);
        return attackers;
    }

    private static void addSliderAttackers(Board board, Square square, Color attackerColor, int[][] directions,
                                           PieceType sliderType, List<Square> attackers, boolean stopAtFirst) {
        for(int[] direction : directions) {
            Square current = square.offset(direction[0], direction[1]);
            while(current != null) {
                Piece piece = board.get(current);
                if(piece != null) {
                    if(piece.color() == attackerColor && (piece.type() == sliderType || piece.type() == PieceType.QUEEN)) {
                        attackers.add(current);
                        if(stopAtFirst) return;
                    }
                    break;
                }
                current = current.offset(direction[0], direction[1]);
            }
        }
    }

    private static boolean isPiece(Board board, Square square, PieceType pieceType, Color color) {
        Piece piece = board.get(square);
        return piece != null && piece.is(pieceType, color);
    }

    public static boolean isKingInCheck(Board board, Color kingColor) {
        Square kingSquare = board.findKing(kingColor);
        return kingSquare != null && isSquareAttacked(board, kingSquare, kingColor.getOppositeColor());
    }

    public static int countCheckers(Board board, Color kingColor) {
        Square kingSquare = board.findKing(kingColor);
        if(kingSquare == null) {
            return 0;
        }
        return getAttackers(board, kingSquare, kingColor.getOppositeColor()).size();
    }

    /**
     * Simulates a plain from/to relocation on a copy and tells whether {@code kingColor}'s king ends up attacked.
     */
    public static boolean wouldKingBeInCheck(Board board, Square from, Square to, Color kingColor) {
        Board dirtyBoard = Board.applyMoveToBoard(board, from, to, null);
        return isKingInCheck(dirtyBoard, kingColor);
    }
}
