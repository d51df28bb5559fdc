package max.chronochess.engine.evolution;

import java.util.Objects;

/**
 * A trigger condition. Numeric conditions compare a measured value against {@code threshold};
 * {@link ConditionType#BOARD_POSITION} conditions check {@code region} instead.
 */
public record AbilityCondition(ConditionType type, ConditionOperator operator, double threshold, BoardRegion region) {
    public AbilityCondition {
        Objects.requireNonNull(type, "type");
        if(type == ConditionType.BOARD_POSITION) {
            Objects.requireNonNull(region, "board position conditions need a region");
        } else {
            Objects.requireNonNull(operator, "numeric conditions need an operator");
        }
    }

    public static AbilityCondition of(ConditionType type, ConditionOperator operator, double threshold) {
        return new AbilityCondition(type, operator, threshold, null);
    }

    public static AbilityCondition at(BoardRegion region) {
        return new AbilityCondition(ConditionType.BOARD_POSITION, null, 0, region);
    }

    @Override
    public String toString() {
        if(type == ConditionType.BOARD_POSITION) {
            return "board_position=" + region.name().toLowerCase();
        }
        return type.name().toLowerCase() + operator.symbol + threshold;
    }
}
