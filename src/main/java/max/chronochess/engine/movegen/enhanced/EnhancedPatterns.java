package max.chronochess.engine.movegen.enhanced;

import max.chronochess.engine.common.Color;
import max.chronochess.engine.common.Piece;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;
import max.chronochess.engine.evolution.AbilityIds;
import max.chronochess.engine.evolution.PieceEvolutionState;
import max.chronochess.engine.game.board.Board;
import max.chronochess.engine.movegen.pieces.Bishop;
import max.chronochess.engine.movegen.pieces.Knight;
import max.chronochess.engine.movegen.pieces.Queen;
import max.chronochess.engine.movegen.pieces.Rook;
import max.chronochess.engine.movegen.pieces.SlidingPieces;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Geometry of every ability, per piece type. Pure functions of the board, the source square and
 * the piece state; cooldowns and activity are checked by the caller. Returned squares may still
 * hold friendly pieces or kings, which the generator filters out.
 */
public final class EnhancedPatterns {
    // Longer L-shapes granted by a dash, on top of the base knight offsets
    public static final int[][] EXTENDED_KNIGHT_OFFSETS = {
            {3, 1}, {1, 3}, {3, 2}, {2, 3}, {4, 1}, {1, 4}
    };

    private EnhancedPatterns() {
    }

    public static List<Square> getCandidates(Board board, Square from, String abilityId, PieceEvolutionState state) {
        Piece piece = board.get(from);
        if(piece == null) {
            return List.of();
        }
        return switch (piece.type()) {
            case PAWN -> switch (abilityId) {
                case AbilityIds.ENHANCED_MARCH -> getEnhancedMarchTargets(board, from, piece.color());
                case AbilityIds.BREAKTHROUGH, AbilityIds.PHASE_THROUGH -> getBreakthroughTargets(board, from, piece.color());
                case AbilityIds.DIAGONAL_MOVE -> getDiagonalStepTargets(board, from);
                default -> List.of();
            };
            case ROOK -> switch (abilityId) {
                case AbilityIds.EXTENDED_RANGE -> SlidingPieces.getRayTargets(board, from, Rook.DIRECTIONS);
                case AbilityIds.ROOK_ENTRENCH -> state != null && state.isEntrenched ? getEntrenchedRookTargets(from) : List.of();
                default -> List.of();
            };
            case BISHOP -> switch (abilityId) {
                case AbilityIds.EXTENDED_RANGE -> SlidingPieces.getRayTargets(board, from, Bishop.DIRECTIONS);
                case AbilityIds.BISHOP_CONSECRATE -> state != null && state.isConsecratedSource ? getConsecratedBishopTargets(from) : List.of();
                default -> List.of();
            };
            case KNIGHT -> AbilityIds.KNIGHT_DASH.equals(abilityId) ? getKnightDashTargets(from) : List.of();
            case QUEEN -> switch (abilityId) {
                case AbilityIds.EXTENDED_RANGE -> SlidingPieces.getRayTargets(board, from, Queen.DIRECTIONS);
                case AbilityIds.QUEEN_DOMINANCE -> getDominanceTargets(from);
                default -> List.of();
            };
            case KING -> List.of();
        };
    }

    /** One and two squares straight ahead, as long as the path is empty. */
    public static List<Square> getEnhancedMarchTargets(Board board, Square from, Color color) {
        List<Square> targets = new ArrayList<>(2);
        Square current = from;
        for(int step = 0; step < 2; step++) {
            current = current.offset(0, color.forward());
            if(current == null || !board.isEmpty(current)) {
                break;
            }
            targets.add(current);
        }
        return targets;
    }

    /** Forward diagonals onto empty squares, and the square ahead when an enemy stands on it. */
    public static List<Square> getBreakthroughTargets(Board board, Square from, Color color) {
        List<Square> targets = new ArrayList<>(3);
        for(int fileDelta : new int[]{-1, 1}) {
            Square diagonal = from.offset(fileDelta, color.forward());
            if(diagonal != null && board.isEmpty(diagonal)) {
                targets.add(diagonal);
            }
        }
        Square ahead = from.offset(0, color.forward());
        if(ahead != null) {
            Piece occupant = board.get(ahead);
            if(occupant != null && occupant.color() != color) {
                targets.add(ahead);
            }
        }
        return targets;
    }

    /** One diagonal step in any direction onto an empty square, never onto a back rank. */
    public static List<Square> getDiagonalStepTargets(Board board, Square from) {
        List<Square> targets = new ArrayList<>(4);
        for(int[] direction : Bishop.DIRECTIONS) {
            Square target = from.offset(direction[0], direction[1]);
            if(target != null && board.isEmpty(target) && target.rank != 0 && target.rank != 7) {
                targets.add(target);
            }
        }
        return targets;
    }

    public static List<Square> getEntrenchedRookTargets(Square from) {
        return SlidingPieces.getUnblockedRayTargets(from, Rook.DIRECTIONS);
    }

    public static List<Square> getConsecratedBishopTargets(Square from) {
        return SlidingPieces.getUnblockedRayTargets(from, Bishop.DIRECTIONS);
    }

    public static List<Square> getDominanceTargets(Square from) {
        return SlidingPieces.getUnblockedRayTargets(from, Queen.DIRECTIONS);
    }

    /** Base L-shapes followed by the extended ones, each in every sign combination. */
    public static List<Square> getKnightDashTargets(Square from) {
        Set<Square> targets = new LinkedHashSet<>();
        for(Square base : Knight.getTargets(from)) {
            targets.add(base);
        }
        for(int[] offset : EXTENDED_KNIGHT_OFFSETS) {
            for(int fileSign : new int[]{1, -1}) {
                for(int rankSign : new int[]{1, -1}) {
                    Square target = from.offset(offset[0] * fileSign, offset[1] * rankSign);
                    if(target != null) {
                        targets.add(target);
                    }
                }
            }
        }
        return new ArrayList<>(targets);
    }

    /** Every empty square, minus the own back rank when the piece is a pawn. */
    public static List<Square> getTeleportTargets(Board board, PieceType pieceType, Color color) {
        List<Square> targets = new ArrayList<>();
        for(Square square : Square.ALL) {
            if(board.isEmpty(square) && !(pieceType == PieceType.PAWN && square.rank == color.backRank())) {
                targets.add(square);
            }
        }
        return targets;
    }

    /** Up to {@code limit} empty neighbouring squares, in flat index order. */
    public static List<Square> getConsecrationBonusTargets(Board board, Square from, int limit) {
        List<Square> targets = new ArrayList<>(limit);
        for(Square square : Square.ALL) {
            if(targets.size() >= limit) {
                break;
            }
            if(square != from && square.chebyshevDistance(from) == 1 && board.isEmpty(square)) {
                targets.add(square);
            }
        }
        return targets;
    }

    public static boolean isPawnOnPromotionSquare(PieceType pieceType, Color color, Square to) {
        return pieceType == PieceType.PAWN && to.rank == color.promotionRank();
    }
}
