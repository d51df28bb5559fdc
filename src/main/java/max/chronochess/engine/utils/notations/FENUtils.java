package max.chronochess.engine.utils.notations;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.Game;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.utils.CheckUtils;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public final class FENUtils {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private FENUtils() {
    }

    /**
     * Parses a full six-field FEN record into a new position and checks it is a playable one:
     * one king per side, no pawn on a back rank, and the side not to move not in check.
     *
     * @throws InvalidFenException when the record is malformed or the position is not playable
     */
    public static Game getBoardFrom(String fen) {
        if(fen == null) {
            throw new InvalidFenException("null", "no record");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length != 6) {
            throw new InvalidFenException(fen, "expected 6 fields, got " + fenFields.length);
        }

        Game game = new Game();
        injectPiecePlacement(game, fen, fenFields[0]);
        injectCurrentTurn(game, fen, fenFields[1]);
        injectCastlingRights(game, fen, fenFields[2]);
        injectEnPassantSquare(game, fen, fenFields[3]);
        game.halfMoveClock = parseCounter(fen, fenFields[4], 0, "half-move clock");
        game.fullMoveClock = parseCounter(fen, fenFields[5], 1, "full-move number");

        validatePosition(game, fen);
        game.sanitizeCastlingRights();
        game.recordPosition();
        return game;
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder(getPositionKey(game));
        fen.append(' ').append(game.halfMoveClock);
        fen.append(' ').append(game.fullMoveClock);
        return fen.toString();
    }

    /** The first four FEN fields, which identify a position for repetition purposes. */
    public static String getPositionKey(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game.board(), fen);
        fen.append(' ').append(game.currentPlayer.fenLetter);
        injectCastlingRights(game, fen);
        fen.append(' ').append(game.enPassantSquare == null ? "-" : game.enPassantSquare.toString());
        return fen.toString();
    }

    public static void validatePosition(Game game, String fen) {
        Board board = game.board();
        for(Color color : Color.values()) {
            int kings = board.count(PieceType.KING, color);
            if(kings != 1) {
                throw new InvalidFenException(fen, "expected one " + color + " king, found " + kings);
            }
        }
        for(int file = 0; file < 8; file++) {
            for(int rank : new int[]{0, 7}) {
                Piece piece = board.get(Square.of(file, rank));
                if(piece != null && piece.type() == PieceType.PAWN) {
                    throw new InvalidFenException(fen, "pawn on back rank " + Square.of(file, rank));
                }
            }
        }
        if(CheckUtils.isKingInCheck(board, game.currentPlayer.getOppositeColor())) {
            throw new InvalidFenException(fen, "side not to move is in check");
        }
    }

    private static void injectPiecePlacement(Board board, StringBuilder fen) {
        for(int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0; file < 8; file++) {
                Piece piece = board.get(Square.of(file, rank));
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.fenLetter());
            }
            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(game.whiteCanCastleKingSide) {
            castlingRights.append('K');
        }
        if(game.whiteCanCastleQueenSide) {
            castlingRights.append('Q');
        }
        if(game.blackCanCastleKingSide) {
            castlingRights.append('k');
        }
        if(game.blackCanCastleQueenSide) {
            castlingRights.append('q');
        }
        fen.append(castlingRights.isEmpty() ? "-" : castlingRights);
    }

    private static void injectPiecePlacement(Game game, String fen, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/", -1);
        if(piecePlacementRows.length != 8) {
            throw new InvalidFenException(fen, "expected 8 ranks");
        }
        Board board = game.board();
        for(int row = 0; row < 8; row++) {
            int rank = 7 - row;
            int file = 0;
            for(char character : piecePlacementRows[row].toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                } else {
                    Piece piece = Piece.fromFenLetter(character);
                    if(piece == null) {
                        throw new InvalidFenException(fen, "unknown piece letter '" + character + "'");
                    }
                    if(file > 7) {
                        throw new InvalidFenException(fen, "rank " + (rank + 1) + " is too long");
                    }
                    board.put(Square.of(file, rank), piece);
                    file++;
                }
            }
            if(file != 8) {
                throw new InvalidFenException(fen, "rank " + (rank + 1) + " does not cover 8 files");
            }
        }
    }

    private static void injectCurrentTurn(Game game, String fen, String currentTurn) {
        Color color = Color.fromFen(currentTurn);
        if(color == null) {
            throw new InvalidFenException(fen, "side to move must be w or b");
        }
        game.currentPlayer = color;
    }

    private static void injectCastlingRights(Game game, String fen, String castlingRights) {
        game.whiteCanCastleKingSide = false;
        game.whiteCanCastleQueenSide = false;
        game.blackCanCastleKingSide = false;
        game.blackCanCastleQueenSide = false;
        if("-".equals(castlingRights)) {
            return;
        }
        for(char character : castlingRights.toCharArray()) {
            switch (character) {
                case 'K' -> game.whiteCanCastleKingSide = true;
                case 'Q' -> game.whiteCanCastleQueenSide = true;
                case 'k' -> game.blackCanCastleKingSide = true;
                case 'q' -> game.blackCanCastleQueenSide = true;
                default -> throw new InvalidFenException(fen, "bad castling rights '" + castlingRights + "'");
            }
        }
    }

    private static void injectEnPassantSquare(Game game, String fen, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            game.enPassantSquare = null;
            return;
        }
        Square square = Square.parse(enPassantSquare);
        int expectedRank = game.currentPlayer == Color.WHITE ? 5 : 2;
        if(square == null || square.rank != expectedRank) {
            throw new InvalidFenException(fen, "bad en passant square '" + enPassantSquare + "'");
        }
        game.enPassantSquare = square;
    }

    private static int parseCounter(String fen, String field, int minimum, String name) {
        try {
            int value = Integer.parseInt(field);
            if(value < minimum) {
                throw new InvalidFenException(fen, name + " below " + minimum);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new InvalidFenException(fen, name + " is not a number");
        }
    }
}
