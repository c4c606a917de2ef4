package io.inboxflow.rules;

/**
 * One parsed line of the handbook's "Custom Flags" section, for example
 * {@code Amount > $1000 → 💰 High-value}.
 */
public record FlagRule(
        String condition,
        String flag,
        Kind kind,
        Comparison comparison,
        double threshold,
        String keyword,
        int days
) {
    public enum Kind { AMOUNT, CONTAINS, DUE_DATE, UNKNOWN }

    public enum Comparison {
        GREATER(">"),
        GREATER_OR_EQUAL(">="),
        LESS("<"),
        LESS_OR_EQUAL("<="),
        EQUAL("=");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean test(double left, double right) {
            switch (this) {
                case GREATER:
                    return left > right;
                case GREATER_OR_EQUAL:
                    return left >= right;
                case LESS:
                    return left < right;
                case LESS_OR_EQUAL:
                    return left <= right;
                default:
                    return Double.compare(left, right) == 0;
            }
        }

        static Comparison fromSymbol(String symbol) {
            if (symbol == null) {
                return null;
            }
            switch (symbol) {
                case ">":
                    return GREATER;
                case ">=":
                    return GREATER_OR_EQUAL;
                case "<":
                    return LESS;
                case "<=":
                    return LESS_OR_EQUAL;
                case "=":
                case "==":
                    return EQUAL;
                default:
                    return null;
            }
        }
    }

    static FlagRule amount(String condition, String flag, Comparison comparison, double threshold) {
        return new FlagRule(condition, flag, Kind.AMOUNT, comparison, threshold, null, 0);
    }

    static FlagRule contains(String condition, String flag, String keyword) {
        return new FlagRule(condition, flag, Kind.CONTAINS, null, 0d, keyword, 0);
    }

    static FlagRule dueDate(String condition, String flag, Comparison comparison, int days) {
        return new FlagRule(condition, flag, Kind.DUE_DATE, comparison, 0d, null, days);
    }

    static FlagRule unknown(String condition, String flag) {
        return new FlagRule(condition, flag, Kind.UNKNOWN, null, 0d, null, 0);
    }
}
