package com.ivamare.pipeline.alerting;

/**
 * How a windowed aggregate is compared to an alarm threshold.
 */
public enum ComparisonOperator {

    GREATER_THAN_OR_EQUAL(">="),
    GREATER_THAN(">"),
    LESS_THAN_OR_EQUAL("<="),
    LESS_THAN("<");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @param value the aggregate
     * @param threshold the alarm threshold
     * @return true if the value breaches the threshold
     */
    public boolean breaches(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN_OR_EQUAL -> value >= threshold;
            case GREATER_THAN -> value > threshold;
            case LESS_THAN_OR_EQUAL -> value <= threshold;
            case LESS_THAN -> value < threshold;
        };
    }
}
