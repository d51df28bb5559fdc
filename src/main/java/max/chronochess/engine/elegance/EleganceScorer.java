package max.chronochess.engine.elegance;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.game.Game;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.Move;
import max.chronochess.engine.movegen.MoveGenerator;
import max.chronochess.engine.movegen.pieces.Bishop;
import max.chronochess.engine.movegen.pieces.King;
import max.chronochess.engine.movegen.pieces.Knight;
import max.chronochess.engine.movegen.pieces.Pawn;
import max.chronochess.engine.movegen.pieces.Queen;
import max.chronochess.engine.movegen.pieces.Rook;
import max.chronochess.engine.movegen.pieces.SlidingPieces;
import max.chronochess.engine.movegen.utils.CheckUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Scores how elegant a move is from the tactical themes it shows.
 * <p>
 * score = sum of theme values * (1 + efficiency) * (1 + complexity), rounded.
 */
public final class EleganceScorer {
    public static final int SACRIFICE = 15;
    public static final int FORK = 10;
    public static final int PIN = 8;
    public static final int SKEWER = 8;
    public static final int DISCOVERED_ATTACK = 12;
    public static final int DOUBLE_CHECK = 20;
    public static final int SMOTHERED_MATE = 50;
    public static final int BACK_RANK_MATE = 25;

    private EleganceScorer() {
    }

    /**
     * @param before      board before the move
     * @param after       board after the move, en passant and castling included
     * @param historySize moves played before this one
     */
    public static int score(Board before, Move move, Board after, int historySize) {
        return score(analyze(before, move, after, historySize));
    }

    public static int score(EleganceFactors factors) {
        double score = 0;
        if(factors.checkmate()) {
            score += factors.checkmatePattern().score;
        }
        if(factors.sacrifice()) score += SACRIFICE;
        if(factors.fork()) score += FORK;
        if(factors.pin()) score += PIN;
        if(factors.skewer()) score += SKEWER;
        if(factors.discoveredAttack()) score += DISCOVERED_ATTACK;
        if(factors.doubleCheck()) score += DOUBLE_CHECK;
        if(factors.smotheredMate()) score += SMOTHERED_MATE;
        if(factors.backRankMate()) score += BACK_RANK_MATE;

        score *= 1 + factors.moveEfficiency();
        score *= 1 + factors.tacticalComplexity();
        return (int) Math.round(score);
    }

    public static EleganceFactors analyze(Board before, Move move, Board after, int historySize) {
        Piece mover = after.get(move.to());
        Piece original = before.get(move.from());
        if(mover == null || original == null) {
            return new EleganceFactors(null, false, false, false, false, false, false, efficiency(move, historySize), 0);
        }
        Color opponent = mover.color().getOppositeColor();

        boolean sacrifice = isSacrifice(original, move, after, opponent);
        boolean fork = isFork(after, move.to(), mover);
        int[] lineThemes = lineThemes(after, move.to(), mover);
        boolean pin = lineThemes[0] > 0;
        boolean skewer = lineThemes[1] > 0;
        boolean discovered = isDiscoveredAttack(before, after, move.to(), mover.color());
        boolean doubleCheck = CheckUtils.countCheckers(after, opponent) >= 2;
        CheckmatePattern mate = checkmatePattern(after, move.to(), mover, opponent);

        double complexity = 0;
        if(fork) complexity += 0.3;
        if(pin) complexity += 0.2;
        if(skewer) complexity += 0.2;
        if(discovered) complexity += 0.4;
        if(sacrifice) complexity += 0.5;

        return new EleganceFactors(mate, sacrifice, fork, pin, skewer, discovered, doubleCheck,
                efficiency(move, historySize), Math.min(1, complexity));
    }

    private static double efficiency(Move move, int historySize) {
        double base = Math.max(0, 1 - historySize / 100.0);
        double captured = move.captured() == null ? 0 : move.captured().value / 10.0;
        return Math.min(1, base + captured);
    }

    // A capture by a more valuable piece that can be taken back
    private static boolean isSacrifice(Piece original, Move move, Board after, Color opponent) {
        if(move.captured() == null) {
            return false;
        }
        return original.type().value > move.captured().value
                && CheckUtils.isSquareAttacked(after, move.to(), opponent);
    }

    private static boolean isFork(Board after, Square square, Piece mover) {
        int valuable = 0;
        for(Square attacked : attackedFrom(after, square, mover)) {
            Piece target = after.get(attacked);
            if(target != null && target.color() != mover.color()
                    && (target.type() == PieceType.QUEEN || target.type() == PieceType.ROOK || target.type() == PieceType.KING)) {
                valuable++;
            }
        }
        return valuable >= 2;
    }

    /** {pins, skewers} along the lines of a sliding mover. */
    private static int[] lineThemes(Board after, Square square, Piece mover) {
        int[] themes = new int[2];
        int[][] directions = directionsOf(mover.type());
        for(int[] direction : directions) {
            Piece front = null;
            Square current = square.offset(direction[0], direction[1]);
            while(current != null) {
                Piece piece = after.get(current);
                if(piece != null) {
                    if(piece.color() == mover.color()) {
                        break;
                    }
                    if(front == null) {
                        front = piece;
                    } else {
                        if(piece.type() == PieceType.KING || piece.type().value > front.type().value) {
                            themes[0]++;
                        } else if(front.type() == PieceType.KING || front.type().value > piece.type().value) {
                            themes[1]++;
                        }
                        break;
                    }
                }
                current = current.offset(direction[0], direction[1]);
            }
        }
        return themes;
    }

    // Another piece of the mover's side now hits a valuable enemy it did not hit before
    private static boolean isDiscoveredAttack(Board before, Board after, Square moved, Color color) {
        for(Square enemy : after.occupiedBy(color.getOppositeColor())) {
            Piece target = after.get(enemy);
            if(target.type() != PieceType.KING && target.type().value < 3) {
                continue;
            }
            List<Square> previous = before.get(enemy) != null && before.get(enemy).color() != color
                    ? CheckUtils.getAttackers(before, enemy, color)
                    : List.of();
            for(Square attacker : CheckUtils.getAttackers(after, enemy, color)) {
                if(attacker != moved && !previous.contains(attacker)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static CheckmatePattern checkmatePattern(Board after, Square moved, Piece mover, Color opponent) {
        if(!CheckUtils.isKingInCheck(after, opponent)) {
            return null;
        }
        Game position = new Game();
        position.setBoard(after.copy());
        position.currentPlayer = opponent;
        position.whiteCanCastleKingSide = false;
        position.whiteCanCastleQueenSide = false;
        position.blackCanCastleKingSide = false;
        position.blackCanCastleQueenSide = false;
        if(MoveGenerator.hasLegalMove(position)) {
            return null;
        }
        Square king = after.findKing(opponent);
        if(mover.type() == PieceType.KNIGHT && isSmothered(after, king, opponent)) {
            return CheckmatePattern.SMOTHERED;
        }
        if(king.rank == 0 || king.rank == 7) {
            return CheckmatePattern.BACK_RANK;
        }
        return CheckmatePattern.PLAIN;
    }

    private static boolean isSmothered(Board board, Square king, Color color) {
        for(Square neighbour : King.getTargets(king)) {
            Piece piece = board.get(neighbour);
            if(piece == null || piece.color() != color) {
                return false;
            }
        }
        return true;
    }

    private static List<Square> attackedFrom(Board board, Square square, Piece piece) {
        return switch (piece.type()) {
            case PAWN -> Arrays.asList(Pawn.getAttackTargets(square, piece.color()));
            case KNIGHT -> Arrays.asList(Knight.getTargets(square));
            case KING -> Arrays.asList(King.getTargets(square));
            default -> SlidingPieces.getRayTargets(board, square, directionsOf(piece.type()));
        };
    }

    private static int[][] directionsOf(PieceType pieceType) {
        return switch (pieceType) {
            case BISHOP -> Bishop.DIRECTIONS;
            case ROOK -> Rook.DIRECTIONS;
            case QUEEN -> Queen.DIRECTIONS;
            default -> new int[0][];
        };
    }
}
