package com.huntflow.pattern;

import com.huntflow.relations.RelationCatalog;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.StoreFilter;

import java.util.Set;
import java.util.function.Consumer;

/**
 * Node of an entity-centered graph pattern. Nodes are immutable; every transformation
 * returns a new tree.
 */
public interface PatternExpression {

    /**
     * Copy of this tree in which every untyped comparison carries {@code centerType}
     */
    PatternExpression withCenter(String centerType);

    /**
     * Copy of this tree with every reference replaced by concrete values. Time bounds of
     * the referenced variables are reported to {@code windows}.
     */
    PatternExpression resolveReferences(ReferenceResolver resolver, Consumer<TimeRange> windows);

    void collectReferences(Set<Reference> references);

    String toWire(String centerType, RelationCatalog catalog);

    StoreFilter toFilter(String centerType, RelationCatalog catalog);
}
