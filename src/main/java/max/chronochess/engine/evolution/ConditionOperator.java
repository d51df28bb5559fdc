package max.chronochess.engine.evolution;

public enum ConditionOperator {
    GREATER(">"), LESS("<"), EQUAL("="), GREATER_OR_EQUAL(">="), LESS_OR_EQUAL("<=");

    public final String symbol;

    ConditionOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER -> value > threshold;
            case LESS -> value < threshold;
            case EQUAL -> value == threshold;
            case GREATER_OR_EQUAL -> value >= threshold;
            case LESS_OR_EQUAL -> value <= threshold;
        };
    }

    public static ConditionOperator fromSymbol(String symbol) {
        for(ConditionOperator operator : values()) {
            if(operator.symbol.equals(symbol)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown condition operator " + symbol);
    }
}
