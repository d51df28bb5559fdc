package max.chronochess.engine.game;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.MoveGenerator;
import max.chronochess.engine.movegen.utils.CheckUtils;
import max.chronochess.engine.utils.notations.FENUtils;

import java.util.List;

/**
 * Standard chess position: board, side to move, castling rights, en passant square and clocks.
 * Only plays moves the standard rules allow; anything else goes through {@link MoveApplier}.
 */
public class Game {
    private Board board;

    public Color currentPlayer = Color.WHITE;
    public boolean whiteCanCastleKingSide = true;
    public boolean whiteCanCastleQueenSide = true;
    public boolean blackCanCastleKingSide = true;
    public boolean blackCanCastleQueenSide = true;
    public Square enPassantSquare = null;

    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    // Position key (FEN without clocks) -> times reached
    private final Object2IntOpenHashMap<String> repetitionCounter;

    public Game() {
        this.board = new Board();
        this.repetitionCounter = new Object2IntOpenHashMap<>();
    }

    private Game(Game other) {
        this.board = other.board.copy();
        this.currentPlayer = other.currentPlayer;
        this.whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        this.whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        this.blackCanCastleKingSide = other.blackCanCastleKingSide;
        this.blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        this.enPassantSquare = other.enPassantSquare;
        this.halfMoveClock = other.halfMoveClock;
        this.fullMoveClock = other.fullMoveClock;
        this.repetitionCounter = new Object2IntOpenHashMap<>(other.repetitionCounter);
    }

    public Game copy() {
        return new Game(this);
    }

    public Board board() {
        return board;
    }

    public void setBoard(Board board) {
        this.board = board;
    }

    public List<Move> getLegalMoves() {
        return MoveGenerator.generateLegalMoves(this);
    }

    public List<Move> getLegalMoves(Square square) {
        return MoveGenerator.generateLegalMoves(this, square);
    }

    /**
     * Plays a move produced by {@link MoveGenerator}. Legality is not checked again here.
     */
    public void playSimpleMove(Move move) {
        Piece moving = board.get(move.from());
        Color mover = moving.color();
        boolean isCapture = move.isCapture();

        if(move.hasFlag(Move.EN_PASSANT)) {
            board.remove(Square.of(move.to().file, move.from().rank));
        }
        if(move.hasFlag(Move.KING_SIDE_CASTLE)) {
            int rank = mover.backRank();
            board.put(Square.of(5, rank), board.remove(Square.of(7, rank)));
        } else if(move.hasFlag(Move.QUEEN_SIDE_CASTLE)) {
            int rank = mover.backRank();
            board.put(Square.of(3, rank), board.remove(Square.of(0, rank)));
        }

        board.remove(move.from());
        board.put(move.to(), move.promotion() == null ? moving : Piece.of(move.promotion(), mover));

        updateCastlingRights(move.from(), move.to());

        if(move.hasFlag(Move.BIG_PAWN)) {
            enPassantSquare = Square.of(move.from().file, move.from().rank + mover.forward());
        } else {
            enPassantSquare = null;
        }

        if(moving.type() == PieceType.PAWN || isCapture) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }

        if(mover == Color.BLACK) {
            fullMoveClock++;
        }

        nextTurn();
        recordPosition();
    }

    /**
     * Drops castling rights whose king or rook left, or got captured on, its home square.
     */
    public void updateCastlingRights(Square from, Square to) {
        for(Square touched : new Square[]{from, to}) {
            switch (touched.toString()) {
                case "e1" -> { whiteCanCastleKingSide = false; whiteCanCastleQueenSide = false; }
                case "e8" -> { blackCanCastleKingSide = false; blackCanCastleQueenSide = false; }
                case "h1" -> whiteCanCastleKingSide = false;
                case "a1" -> whiteCanCastleQueenSide = false;
                case "h8" -> blackCanCastleKingSide = false;
                case "a8" -> blackCanCastleQueenSide = false;
                default -> { }
            }
        }
    }

    /**
     * Keeps only the castling rights still backed by a king and rook on their home squares.
     */
    public void sanitizeCastlingRights() {
        whiteCanCastleKingSide &= hasHomePieces(Color.WHITE, 7);
        whiteCanCastleQueenSide &= hasHomePieces(Color.WHITE, 0);
        blackCanCastleKingSide &= hasHomePieces(Color.BLACK, 7);
        blackCanCastleQueenSide &= hasHomePieces(Color.BLACK, 0);
    }

    private boolean hasHomePieces(Color color, int rookFile) {
        int rank = color.backRank();
        Piece king = board.get(Square.of(4, rank));
        Piece rook = board.get(Square.of(rookFile, rank));
        return king != null && king.is(PieceType.KING, color) && rook != null && rook.is(PieceType.ROOK, color);
    }

    public void nextTurn() {
        currentPlayer = currentPlayer.getOppositeColor();
    }

    public void recordPosition() {
        repetitionCounter.addTo(FENUtils.getPositionKey(this), 1);
    }

    /** Adds the positions counted by {@code previous} to this game's own counts. */
    public void inheritRepetitions(Game previous) {
        for(Object2IntMap.Entry<String> entry : previous.repetitionCounter.object2IntEntrySet()) {
            repetitionCounter.addTo(entry.getKey(), entry.getIntValue());
        }
    }

    public int repetitionCount() {
        return repetitionCounter.getInt(FENUtils.getPositionKey(this));
    }

    public boolean inCheck() {
        return CheckUtils.isKingInCheck(board, currentPlayer);
    }

    public boolean isADraw() {
        return isInsufficientMaterial()
                || repetitionCount() >= 3 // 3fold repetition
                || halfMoveClock >= 100;  // 50-moves rule
    }

    public PlayerState getPlayerState() {
        boolean legalMovePossible = MoveGenerator.hasLegalMove(this);
        if(!legalMovePossible) {
            // We have no legal move possible, so we are either in pat or checkmate depending on the king check state
            return inCheck() ? PlayerState.CHECKMATE : PlayerState.PAT;
        }
        if(isADraw()) {
            return PlayerState.DRAW;
        }
        return PlayerState.IN_PROGRESS;
    }

    // K v K, K+minor v K, and K+B v K+B with bishops on the same square color
    public boolean isInsufficientMaterial() {
        int minorPieces = 0;
        int bishopSquareColors = 0; // bit 0 dark, bit 1 light
        int bishops = 0;
        for(Square square : board.occupied()) {
            Piece piece = board.get(square);
            switch (piece.type()) {
                case KING -> { }
                case KNIGHT -> minorPieces++;
                case BISHOP -> {
                    minorPieces++;
                    bishops++;
                    bishopSquareColors |= square.isLightSquare() ? 2 : 1;
                }
                default -> {
                    return false;
                }
            }
        }
        if(minorPieces <= 1) {
            return true;
        }
        return bishops == minorPieces && bishopSquareColors != 3;
    }

    @Override
    public String toString() {
        return board.toAscii() + "\nFEN: " + FENUtils.getFENFromBoard(this);
    }
}
