package max.chronochess.engine.utils.notations;

import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.Game;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.MoveGenerator;

import java.util.List;

public final class MoveIOUtils {
    private MoveIOUtils() {
    }

    /**
     * Standard algebraic notation of {@code move}, played from {@code game}. {@code legalMoves} are
     * the moves of the side to move, used for disambiguation.
     */
    public static String writeAlgebraicNotation(Game game, Move move, List<Move> legalMoves) {
        String san = writeAlgebraicNotationWithoutCheck(move, legalMoves);
        Game after = game.copy();
        after.playSimpleMove(move);
        if(after.inCheck()) {
            san += MoveGenerator.hasLegalMove(after) ? "+" : "#";
        }
        return san;
    }

    public static String writeAlgebraicNotationWithoutCheck(Move move, List<Move> legalMoves) {
        if(move.hasFlag(Move.KING_SIDE_CASTLE)) {
            return "O-O";
        }
        if(move.hasFlag(Move.QUEEN_SIDE_CASTLE)) {
            return "O-O-O";
        }
        StringBuilder san = new StringBuilder();
        if(move.pieceType() == PieceType.PAWN) {
            if(move.isCapture()) {
                san.append((char) ('a' + move.from().file));
            }
        } else {
            san.append(move.pieceType().sanLetter());
            san.append(getDisambiguation(move, legalMoves));
        }
        if(move.isCapture()) {
            san.append('x');
        }
        san.append(move.to());
        if(move.promotion() != null) {
            san.append('=').append(move.promotion().sanLetter());
        }
        return san.toString();
    }

    /**
     * SAN for moves the standard rules cannot express: piece letter, optional capture mark and
     * destination, with no disambiguation or check suffix.
     */
    public static String writeEnhancedNotation(Move move) {
        StringBuilder san = new StringBuilder();
        if(move.pieceType() != PieceType.PAWN) {
            san.append(move.pieceType().sanLetter());
        } else if(move.isCapture()) {
            san.append((char) ('a' + move.from().file));
        }
        if(move.isCapture()) {
            san.append('x');
        }
        san.append(move.to());
        if(move.promotion() != null) {
            san.append('=').append(move.promotion().sanLetter());
        }
        return san.toString();
    }

    private static String getDisambiguation(Move move, List<Move> legalMoves) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for(Move other : legalMoves) {
            if(other.from() == move.from() || other.to() != move.to() || other.pieceType() != move.pieceType()) {
                continue;
            }
            ambiguous = true;
            if(other.from().file == move.from().file) {
                sameFile = true;
            }
            if(other.from().rank == move.from().rank) {
                sameRank = true;
            }
        }
        if(!ambiguous) {
            return "";
        }
        if(!sameFile) {
            return String.valueOf((char) ('a' + move.from().file));
        }
        if(!sameRank) {
            return String.valueOf((char) ('1' + move.from().rank));
        }
        return move.from().toString();
    }

    /** Strips check marks, annotations and an en passant suffix so SAN can be compared. */
    public static String normalizeAlgebraicNotation(String san) {
        String normalized = san.trim().replace("e.p.", "").trim();
        normalized = normalized.replaceAll("[+#!?]", "");
        return normalized.replace('0', 'O');
    }

    /**
     * Parses long algebraic notation such as e2e4 or e7e8q.
     *
     * @return the move with only from, to and promotion set, or null when the text is not one
     */
    public static Move parseCoordinateNotation(String text) {
        if(text == null) {
            return null;
        }
        String trimmed = text.trim();
        if(trimmed.length() != 4 && trimmed.length() != 5) {
            return null;
        }
        Square from = Square.parse(trimmed.substring(0, 2));
        Square to = Square.parse(trimmed.substring(2, 4));
        if(from == null || to == null) {
            return null;
        }
        PieceType promotion = null;
        if(trimmed.length() == 5) {
            promotion = getPieceTypeFromLetter(trimmed.charAt(4));
            if(promotion == null || promotion == PieceType.PAWN || promotion == PieceType.KING) {
                return null;
            }
        }
        return Move.standard(from, to, promotion, null, null, null);
    }

    public static PieceType getPieceTypeFromLetter(char letter) {
        return PieceType.fromLetter(letter);
    }
}
