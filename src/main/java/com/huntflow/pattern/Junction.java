package com.huntflow.pattern;

import com.huntflow.relations.RelationCatalog;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.FilterJunction;
import com.huntflow.store.StoreFilter;

import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Represents an AND / OR of two pattern expressions
 */
public class Junction implements PatternExpression {

    public enum Kind {
        AND,
        OR
    }

    private final Kind kind;
    private final PatternExpression left;
    private final PatternExpression right;

    public Junction(Kind kind, PatternExpression left, PatternExpression right) {
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public Kind getKind() {
        return kind;
    }

    public PatternExpression getLeft() {
        return left;
    }

    public PatternExpression getRight() {
        return right;
    }

    @Override
    public PatternExpression withCenter(String centerType) {
        return new Junction(kind, left.withCenter(centerType), right.withCenter(centerType));
    }

    @Override
    public PatternExpression resolveReferences(ReferenceResolver resolver, Consumer<TimeRange> windows) {
        return new Junction(kind, left.resolveReferences(resolver, windows), right.resolveReferences(resolver, windows));
    }

    @Override
    public void collectReferences(Set<Reference> references) {
        left.collectReferences(references);
        right.collectReferences(references);
    }

    @Override
    public String toWire(String centerType, RelationCatalog catalog) {
        return "(" + left.toWire(centerType, catalog) + " " + kind + " " + right.toWire(centerType, catalog) + ")";
    }

    @Override
    public StoreFilter toFilter(String centerType, RelationCatalog catalog) {
        return new FilterJunction(kind.name(), left.toFilter(centerType, catalog), right.toFilter(centerType, catalog));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Junction)) return false;
        Junction that = (Junction) o;
        return kind == that.kind && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, left, right);
    }

    @Override
    public String toString() {
        return "(" + left + " " + kind + " " + right + ")";
    }
}
