package max.chronochess.engine.game;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.MoveGenerator;
import max.chronochess.engine.utils.notations.FENUtils;
import max.chronochess.engine.utils.notations.InvalidFenException;
import max.chronochess.engine.utils.notations.MoveIOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class StandardRulesOracle implements RulesOracle {
    private static final Logger LOGGER = LoggerFactory.getLogger(StandardRulesOracle.class);

    private Game game;

    public StandardRulesOracle() {
        this.game = FENUtils.getBoardFrom(FENUtils.STANDARD_GAME);
    }

    @Override
    public boolean load(String fen) {
        try {
            this.game = FENUtils.getBoardFrom(fen);
            return true;
        } catch (InvalidFenException e) {
            LOGGER.warn("Rejected FEN: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean continueFrom(String fen) {
        try {
            Game next = FENUtils.getBoardFrom(fen);
            next.inheritRepetitions(game);
            this.game = next;
            return true;
        } catch (InvalidFenException e) {
            LOGGER.warn("Rejected FEN: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Move move(Square from, Square to, PieceType promotion) {
        List<Move> legalMoves = game.getLegalMoves();
        for(Move candidate : legalMoves) {
            if(candidate.from() != from || candidate.to() != to) {
                continue;
            }
            if(candidate.promotion() != null) {
                PieceType wanted = promotion == null ? PieceType.QUEEN : promotion;
                if(candidate.promotion() != wanted) {
                    continue;
                }
            }
            return play(candidate, legalMoves);
        }
        return null;
    }

    @Override
    public Move move(String notation) {
        if(notation == null || notation.isBlank()) {
            return null;
        }
        Move coordinates = MoveIOUtils.parseCoordinateNotation(notation);
        if(coordinates != null) {
            return move(coordinates.from(), coordinates.to(), coordinates.promotion());
        }
        String wanted = MoveIOUtils.normalizeAlgebraicNotation(notation);
        List<Move> legalMoves = game.getLegalMoves();
        for(Move candidate : legalMoves) {
            String san = MoveIOUtils.writeAlgebraicNotationWithoutCheck(candidate, legalMoves);
            if(san.equals(wanted)) {
                return play(candidate, legalMoves);
            }
        }
        return null;
    }

    private Move play(Move move, List<Move> legalMoves) {
        Move withSan = move.withSan(MoveIOUtils.writeAlgebraicNotation(game, move, legalMoves));
        game.playSimpleMove(move);
        return withSan;
    }

    @Override
    public List<Move> moves() {
        return withSan(game.getLegalMoves());
    }

    @Override
    public List<Move> moves(Square square) {
        return withSan(game.getLegalMoves(square));
    }

    @Override
    public List<Move> movesFor(Square square) {
        Piece piece = game.board().get(square);
        if(piece != null && piece.color() == game.currentPlayer) {
            return moves(square);
        }
        List<Move> moves = MoveGenerator.generateLegalMovesFor(game, square);
        List<Move> result = new ArrayList<>(moves.size());
        for(Move move : moves) {
            result.add(move.withSan(MoveIOUtils.writeAlgebraicNotationWithoutCheck(move, moves)));
        }
        return result;
    }

    private List<Move> withSan(List<Move> moves) {
        List<Move> allMoves = game.getLegalMoves();
        List<Move> result = new ArrayList<>(moves.size());
        for(Move move : moves) {
            result.add(move.withSan(MoveIOUtils.writeAlgebraicNotation(game, move, allMoves)));
        }
        return result;
    }

    @Override
    public Piece get(Square square) {
        return game.board().get(square);
    }

    @Override
    public Color turn() {
        return game.currentPlayer;
    }

    @Override
    public boolean inCheck() {
        return game.inCheck();
    }

    @Override
    public boolean isCheckmate() {
        return game.getPlayerState() == PlayerState.CHECKMATE;
    }

    @Override
    public boolean isStalemate() {
        return game.getPlayerState() == PlayerState.PAT;
    }

    @Override
    public boolean isDraw() {
        PlayerState state = game.getPlayerState();
        return state == PlayerState.DRAW || state == PlayerState.PAT;
    }

    @Override
    public boolean isGameOver() {
        return game.getPlayerState() != PlayerState.IN_PROGRESS;
    }

    @Override
    public Board board() {
        return game.board().copy();
    }

    @Override
    public String fen() {
        return FENUtils.getFENFromBoard(game);
    }

    @Override
    public int halfMoveClock() {
        return game.halfMoveClock;
    }

    @Override
    public int fullMoveNumber() {
        return game.fullMoveClock;
    }
}
