package com.huntflow.pattern;

import com.huntflow.relations.RelationCatalog;
import com.huntflow.relations.UnsupportedRelationException;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.FilterPredicate;
import com.huntflow.store.StoreFilter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Represents a comparison leaf: {@code [type:]attribute OP value}
 *
 * <p>The value is a literal (String, Long, Double, Boolean, Instant, {@link NullLiteral}),
 * a list of literals, or a {@link Reference}. Operator/value arity is checked on
 * construction.
 */
public class Comparison implements PatternExpression {
    private final String entityType;
    private final String attribute;
    private final Operator operator;
    private final Object value;

    public Comparison(String entityType, String attribute, Operator operator, Object value) {
        validate(operator, value);
        this.entityType = entityType;
        this.attribute = attribute;
        this.operator = operator;
        this.value = value instanceof Collection ? List.copyOf((Collection<?>) value) : value;
    }

    private static void validate(Operator operator, Object value) {
        if (value instanceof Collection && !operator.isListOperator()) {
            throw new InvalidPatternException("a list should be paired with the operator \"IN\"");
        }
        if (operator.isListOperator() && !(value instanceof Collection) && !(value instanceof Reference)) {
            throw new InvalidPatternException("inappropriately pair operator \"" + operator + "\" with literal");
        }
    }

    /**
     * Entity type the attribute belongs to, or null before a center is bound
     */
    public String getEntityType() {
        return entityType;
    }

    public String getAttribute() {
        return attribute;
    }

    public Operator getOperator() {
        return operator;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public PatternExpression withCenter(String centerType) {
        if (entityType != null) {
            return this;
        }
        return new Comparison(centerType, attribute, operator, value);
    }

    @Override
    public PatternExpression resolveReferences(ReferenceResolver resolver, Consumer<TimeRange> windows) {
        if (value instanceof Reference) {
            List<Object> values = lookup((Reference) value, resolver, windows);
            if (operator.isListOperator()) {
                return new Comparison(entityType, attribute, operator, values);
            }
            if (values.size() == 1) {
                return new Comparison(entityType, attribute, operator, values.get(0));
            }
            return new Comparison(entityType, attribute, operator.widen(), values);
        }
        if (value instanceof Collection && ((Collection<?>) value).stream().anyMatch(v -> v instanceof Reference)) {
            Set<Object> flattened = new LinkedHashSet<>();
            for (Object item : (Collection<?>) value) {
                if (item instanceof Reference) {
                    flattened.addAll(lookup((Reference) item, resolver, windows));
                } else {
                    flattened.add(item);
                }
            }
            return new Comparison(entityType, attribute, operator, new ArrayList<>(flattened));
        }
        return this;
    }

    private static List<Object> lookup(Reference reference, ReferenceResolver resolver, Consumer<TimeRange> windows) {
        List<Object> values = resolver.values(reference);
        if (values.isEmpty()) {
            throw new InvalidPatternException("reference " + reference + " has no value");
        }
        resolver.timeBounds(reference.getVariable()).ifPresent(windows);
        return values;
    }

    @Override
    public void collectReferences(Set<Reference> references) {
        if (value instanceof Reference) {
            references.add((Reference) value);
        } else if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item instanceof Reference) {
                    references.add((Reference) item);
                }
            }
        }
    }

    @Override
    public String toWire(String centerType, RelationCatalog catalog) {
        PatternExpression rewritten = rewriteForCenter(centerType, catalog);
        if (rewritten != this) {
            return rewritten.toWire(centerType, catalog);
        }
        String type = entityType != null ? entityType : centerType;
        return type + ":" + attribute + " " + operator.getSymbol() + " " + PatternLiterals.toWire(value);
    }

    @Override
    public StoreFilter toFilter(String centerType, RelationCatalog catalog) {
        PatternExpression rewritten = rewriteForCenter(centerType, catalog);
        if (rewritten != this) {
            return rewritten.toFilter(centerType, catalog);
        }
        if (value instanceof Reference) {
            throw new InvalidPatternException("unresolved reference " + value);
        }
        return new FilterPredicate(attribute, operator, value);
    }

    /**
     * A comparison on a type other than the center becomes one comparison per reference
     * path from the center, OR-ed together
     */
    private PatternExpression rewriteForCenter(String centerType, RelationCatalog catalog) {
        if (entityType == null || centerType == null || entityType.equals(centerType)) {
            return this;
        }
        List<String> paths = catalog.pathsBetween(centerType, entityType);
        if (paths.isEmpty()) {
            throw new UnsupportedRelationException(centerType, entityType);
        }
        PatternExpression result = null;
        for (String path : paths) {
            Comparison leaf = new Comparison(centerType, path + "." + attribute, operator, value);
            result = result == null ? leaf : new Junction(Junction.Kind.OR, result, leaf);
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comparison)) return false;
        Comparison that = (Comparison) o;
        return Objects.equals(entityType, that.entityType)
                && attribute.equals(that.attribute)
                && operator == that.operator
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityType, attribute, operator, value);
    }

    @Override
    public String toString() {
        String prefix = entityType != null ? entityType + ":" : "";
        return prefix + attribute + " " + operator.getSymbol() + " " + value;
    }
}
