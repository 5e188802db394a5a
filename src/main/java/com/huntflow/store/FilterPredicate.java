package com.huntflow.store;

import com.huntflow.pattern.NullLiteral;
import com.huntflow.pattern.Operator;
import com.huntflow.pattern.PatternLiterals;

import java.util.Collection;
import java.util.Map;

/**
 * Leaf filter: {@code column OP value}
 */
public class FilterPredicate implements StoreFilter {
    private final String column;
    private final Operator operator;
    private final Object value;

    public FilterPredicate(String column, Operator operator, Object value) {
        this.column = column;
        this.operator = operator;
        this.value = value;
    }

    public String getColumn() {
        return column;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public boolean test(Map<String, Object> row) {
        Object actual = row.get(column);
        if (value == NullLiteral.INSTANCE) {
            boolean isNull = actual == null || (actual instanceof Collection && ((Collection<?>) actual).isEmpty());
            if (operator == Operator.EQUAL) {
                return isNull;
            }
            if (operator == Operator.NOT_EQUAL) {
                return !isNull;
            }
            throw new StorePatternException("operator " + operator + " cannot be applied to NULL", toSql());
        }
        if (actual == null) {
            return false;
        }
        switch (operator) {
            case EQUAL:
                return RowValues.anyEquals(actual, value);
            case NOT_EQUAL:
                return !RowValues.anyEquals(actual, value);
            case LESS_THAN:
                return RowValues.compare(actual, value) < 0;
            case LESS_THAN_OR_EQUAL:
                return RowValues.compare(actual, value) <= 0;
            case GREATER_THAN:
                return RowValues.compare(actual, value) > 0;
            case GREATER_THAN_OR_EQUAL:
                return RowValues.compare(actual, value) >= 0;
            case LIKE:
                return RowValues.like(actual, String.valueOf(value));
            case MATCHES:
                return RowValues.matches(actual, String.valueOf(value), toSql());
            case IN:
                return values().stream().anyMatch(v -> RowValues.anyEquals(actual, v));
            case NOT_IN:
                return values().stream().noneMatch(v -> RowValues.anyEquals(actual, v));
            case ISSUBSET:
                return RowValues.isSubset(actual, String.valueOf(value), toSql());
            case NOT_ISSUBSET:
                return !RowValues.isSubset(actual, String.valueOf(value), toSql());
            default:
                throw new StorePatternException("unsupported operator " + operator, toSql());
        }
    }

    private Collection<?> values() {
        if (!(value instanceof Collection)) {
            throw new StorePatternException("operator " + operator + " requires a list", toSql());
        }
        return (Collection<?>) value;
    }

    @Override
    public String toSql() {
        String quoted = RowValues.quoteColumn(column);
        if (value == NullLiteral.INSTANCE) {
            return quoted + (operator == Operator.NOT_EQUAL ? " IS NOT NULL" : " IS NULL");
        }
        return quoted + " " + operator.getSymbol() + " " + PatternLiterals.toSql(value);
    }

    @Override
    public String toString() {
        return toSql();
    }
}
