package max.chronochess.engine.movegen;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.Game;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.pieces.Bishop;
import max.chronochess.engine.movegen.pieces.King;
import max.chronochess.engine.movegen.pieces.Knight;
import max.chronochess.engine.movegen.pieces.Pawn;
import max.chronochess.engine.movegen.pieces.Queen;
import max.chronochess.engine.movegen.pieces.Rook;
import max.chronochess.engine.movegen.pieces.SlidingPieces;
import max.chronochess.engine.movegen.utils.CheckUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Standard chess move generation. Moves are generated pseudo-legally per piece then filtered by
 * simulating them and checking the mover's king.
 */
public final class MoveGenerator {
    private MoveGenerator() {
    }

    public static void warmUp() {
        Knight.warmUp();
        King.warmUp();
    }

    public static List<Move> generateLegalMoves(Game game) {
        List<Move> moves = new ArrayList<>(64);
        for(Square square : game.board().occupiedBy(game.currentPlayer)) {
            addLegalMoves(game, square, moves);
        }
        return moves;
    }

    /** Legal moves of the piece on {@code square}; empty if it does not belong to the side to move. */
    public static List<Move> generateLegalMoves(Game game, Square square) {
        List<Move> moves = new ArrayList<>(16);
        Piece piece = game.board().get(square);
        if(piece != null && piece.color() == game.currentPlayer) {
            addLegalMoves(game, square, moves);
        }
        return moves;
    }

    /**
     * Legal moves of the piece on {@code square} as if its side were to move. En passant is only
     * kept when it really is that side's turn.
     */
    public static List<Move> generateLegalMovesFor(Game game, Square square) {
        Piece piece = game.board().get(square);
        if(piece == null) {
            return new ArrayList<>();
        }
        if(piece.color() == game.currentPlayer) {
            return generateLegalMoves(game, square);
        }
        Game turned = game.copy();
        turned.currentPlayer = piece.color();
        turned.enPassantSquare = null;
        return generateLegalMoves(turned, square);
    }

    public static boolean hasLegalMove(Game game) {
        List<Move> moves = new ArrayList<>(16);
        for(Square square : game.board().occupiedBy(game.currentPlayer)) {
            addLegalMoves(game, square, moves);
            if(!moves.isEmpty()) {
                return true;
            }
        }
        return false;
    }

    public static long perft(Game game, int depth) {
        List<Move> moves = generateLegalMoves(game);
        if(depth == 1) {
            return moves.size();
        }
        long nodes = 0;
        for(Move move : moves) {
            Game child = game.copy();
            child.playSimpleMove(move);
            nodes += perft(child, depth - 1);
        }
        return nodes;
    }

    private static void addLegalMoves(Game game, Square square, List<Move> moves) {
        List<Move> pseudoLegalMoves = new ArrayList<>(16);
        addPseudoLegalMoves(game, square, pseudoLegalMoves);
        Color mover = game.board().get(square).color();
        for(Move move : pseudoLegalMoves) {
            if(!CheckUtils.isKingInCheck(boardAfter(game.board(), move), mover)) {
                moves.add(move);
            }
        }
    }

    /**
     * Board after {@code move}, handling the en passant victim and the castling rook.
     */
    public static Board boardAfter(Board board, Move move) {
        Piece moving = board.get(move.from());
        Board after = Board.applyMoveToBoard(board, move.from(), move.to(), move.promotion());
        if(move.hasFlag(Move.EN_PASSANT)) {
            after.remove(Square.of(move.to().file, move.from().rank));
        }
        if(move.hasFlag(Move.KING_SIDE_CASTLE)) {
            int rank = moving.color().backRank();
            after.put(Square.of(5, rank), after.remove(Square.of(7, rank)));
        } else if(move.hasFlag(Move.QUEEN_SIDE_CASTLE)) {
            int rank = moving.color().backRank();
            after.put(Square.of(3, rank), after.remove(Square.of(0, rank)));
        }
        return after;
    }

    private static void addPseudoLegalMoves(Game game, Square square, List<Move> moves) {
        Board board = game.board();
        Piece piece = board.get(square);
        switch (piece.type()) {
            case PAWN -> addPawnMoves(game, square, piece.color(), moves);
            case KNIGHT -> addTargets(board, square, piece, Knight.getTargets(square), moves);
            case BISHOP -> addTargets(board, square, piece, SlidingPieces.getRayTargets(board, square, Bishop.DIRECTIONS).toArray(new Square[0]), moves);
            case ROOK -> addTargets(board, square, piece, SlidingPieces.getRayTargets(board, square, Rook.DIRECTIONS).toArray(new Square[0]), moves);
            case QUEEN -> addTargets(board, square, piece, SlidingPieces.getRayTargets(board, square, Queen.DIRECTIONS).toArray(new Square[0]), moves);
            case KING -> {
                addTargets(board, square, piece, King.getTargets(square), moves);
                addCastlingMoves(game, square, piece.color(), moves);
            }
        }
    }

    private static void addTargets(Board board, Square from, Piece piece, Square[] targets, List<Move> moves) {
        for(Square target : targets) {
            Piece occupant = board.get(target);
            if(occupant == null) {
                moves.add(Move.standard(from, target, null, piece.type(), null, "n"));
            } else if(occupant.color() != piece.color()) {
                moves.add(Move.standard(from, target, null, piece.type(), occupant.type(), "c"));
            }
        }
    }

    private static void addPawnMoves(Game game, Square from, Color color, List<Move> moves) {
        Board board = game.board();
        Square oneStep = from.offset(0, color.forward());
        if(oneStep != null && board.isEmpty(oneStep)) {
            addPawnMove(from, oneStep, null, "n", moves, color);
            Square twoSteps = oneStep.offset(0, color.forward());
            if(Pawn.isOnStartRank(from, color) && twoSteps != null && board.isEmpty(twoSteps)) {
                moves.add(Move.standard(from, twoSteps, null, PieceType.PAWN, null, "b"));
            }
        }
        for(Square target : Pawn.getAttackTargets(from, color)) {
            Piece occupant = board.get(target);
            if(occupant != null && occupant.color() != color) {
                addPawnMove(from, target, occupant.type(), "c", moves, color);
            } else if(occupant == null && target == game.enPassantSquare && color == game.currentPlayer) {
                moves.add(Move.standard(from, target, null, PieceType.PAWN, PieceType.PAWN, "e"));
            }
        }
    }

    private static void addPawnMove(Square from, Square to, PieceType captured, String flags, List<Move> moves, Color color) {
        if(Pawn.isPromotionSquare(to, color)) {
            for(PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(Move.standard(from, to, promotion, PieceType.PAWN, captured, flags + Move.PROMOTION));
            }
        } else {
            moves.add(Move.standard(from, to, null, PieceType.PAWN, captured, flags));
        }
    }

    private static void addCastlingMoves(Game game, Square kingSquare, Color color, List<Move> moves) {
        int rank = color.backRank();
        if(kingSquare != Square.of(4, rank)) {
            return;
        }
        boolean kingSide = color == Color.WHITE ? game.whiteCanCastleKingSide : game.blackCanCastleKingSide;
        boolean queenSide = color == Color.WHITE ? game.whiteCanCastleQueenSide : game.blackCanCastleQueenSide;
        if(!kingSide && !queenSide) {
            return;
        }
        Board board = game.board();
        Color enemy = color.getOppositeColor();
        if(CheckUtils.isSquareAttacked(board, kingSquare, enemy)) {
            return;
        }
        Piece ownRook = Piece.of(PieceType.ROOK, color);
        if(kingSide
                && ownRook.equals(board.get(Square.of(7, rank)))
                && board.isEmpty(Square.of(5, rank)) && board.isEmpty(Square.of(6, rank))
                && !CheckUtils.isSquareAttacked(board, Square.of(5, rank), enemy)
                && !CheckUtils.isSquareAttacked(board, Square.of(6, rank), enemy)) {
            moves.add(Move.standard(kingSquare, Square.of(6, rank), null, PieceType.KING, null, "k"));
        }
        if(queenSide
                && ownRook.equals(board.get(Square.of(0, rank)))
                && board.isEmpty(Square.of(1, rank)) && board.isEmpty(Square.of(2, rank)) && board.isEmpty(Square.of(3, rank))
                && !CheckUtils.isSquareAttacked(board, Square.of(3, rank), enemy)
                && !CheckUtils.isSquareAttacked(board, Square.of(2, rank), enemy)) {
            moves.add(Move.standard(kingSquare, Square.of(2, rank), null, PieceType.KING, null, "q"));
        }
    }
}
