package max.chronochess.engine.movegen;

import max.chronochess.engine.ability.AbilityResult;
import max.chronochess.engine.common.PieceType;
import max.chronochess.engine.common.Square;

import java.util.List;

/**
 * A move as handed out by the engine. Standard moves come from the rules oracle; enhanced moves
 * carry the id of the ability that produced them in {@code enhancedBy}.
 *
 * @param flags single letter flags: n normal, b big pawn push, c capture, e en passant,
 *              k/q castling, p promotion
 */
public record Move(Square from,
                   Square to,
                   PieceType promotion,
                   PieceType pieceType,
                   PieceType captured,
                   String san,
                   String flags,
                   String enhancedBy,
                   Integer eleganceScore,
                   List<AbilityResult> abilities) {
    public static final String MODIFIED_TAG = "modified";

    public static final char NORMAL = 'n';
    public static final char BIG_PAWN = 'b';
    public static final char CAPTURE = 'c';
    public static final char EN_PASSANT = 'e';
    public static final char KING_SIDE_CASTLE = 'k';
    public static final char QUEEN_SIDE_CASTLE = 'q';
    public static final char PROMOTION = 'p';

    public Move {
        abilities = abilities == null ? List.of() : List.copyOf(abilities);
    }

    public static Move standard(Square from, Square to, PieceType promotion, PieceType pieceType, PieceType captured, String flags) {
        return new Move(from, to, promotion, pieceType, captured, null, flags, null, null, List.of());
    }

    public boolean isCapture() {
        return hasFlag(CAPTURE) || hasFlag(EN_PASSANT);
    }

    public boolean isEnhanced() {
        return enhancedBy != null;
    }

    public boolean hasFlag(char flag) {
        return flags != null && flags.indexOf(flag) >= 0;
    }

    public boolean isCastling() {
        return hasFlag(KING_SIDE_CASTLE) || hasFlag(QUEEN_SIDE_CASTLE);
    }

    public boolean sameSquares(Move other) {
        return from == other.from && to == other.to && promotion == other.promotion;
    }

    public Move withSan(String newSan) {
        return new Move(from, to, promotion, pieceType, captured, newSan, flags, enhancedBy, eleganceScore, abilities);
    }

    public Move withEnhancedBy(String abilityId) {
        return new Move(from, to, promotion, pieceType, captured, san, flags, abilityId, eleganceScore, abilities);
    }

    public Move withEleganceScore(Integer score) {
        return new Move(from, to, promotion, pieceType, captured, san, flags, enhancedBy, score, abilities);
    }

    public Move withAbilities(List<AbilityResult> results) {
        return new Move(from, to, promotion, pieceType, captured, san, flags, enhancedBy, eleganceScore, results);
    }

    /** Long algebraic form, e.g. e7e8q. */
    public String toUci() {
        String uci = from.toString() + to;
        if(promotion != null) {
            uci += promotion.letter;
        }
        return uci;
    }

    @Override
    public String toString() {
        return san != null ? san : toUci();
    }
}
