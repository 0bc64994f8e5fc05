package dev.haddaf.sync.store;

import java.util.Objects;

public enum FilterOperator {
    EQUAL,
    LESS_THAN,
    LESS_THAN_OR_EQUAL,
    GREATER_THAN,
    GREATER_THAN_OR_EQUAL;

    /**
     * Evaluates the operator against a field value the way the remote store does: values of different
     * kinds never match, and a missing field matches nothing.
     */
    public boolean matches(Object actual, Object expected) {
        if (actual == null) {
            return false;
        }
        if (this == EQUAL) {
            if (actual instanceof Number left && expected instanceof Number right) {
                return Double.compare(left.doubleValue(), right.doubleValue()) == 0;
            }
            return Objects.equals(actual, expected);
        }
        Integer comparison = compare(actual, expected);
        if (comparison == null) {
            return false;
        }
        return switch (this) {
            case LESS_THAN -> comparison < 0;
            case LESS_THAN_OR_EQUAL -> comparison <= 0;
            case GREATER_THAN -> comparison > 0;
            case GREATER_THAN_OR_EQUAL -> comparison >= 0;
            case EQUAL -> comparison == 0;
        };
    }

    @SuppressWarnings("unchecked")
    static Integer compare(Object left, Object right) {
        if (left == null || right == null) {
            return null;
        }
        if (left instanceof Number a && right instanceof Number b) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (left instanceof Comparable<?> && left.getClass().equals(right.getClass())) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return null;
    }
}
