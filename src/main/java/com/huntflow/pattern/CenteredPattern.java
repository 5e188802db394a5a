package com.huntflow.pattern;

import com.huntflow.InternalInvariantException;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.StoreFilter;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * A pattern tree together with its center entity type and the time window its
 * references contribute.
 *
 * <p>Lifecycle: parse, {@link #bindCenter} exactly once, {@link #resolveReferences},
 * then compile with {@link #toWirePattern} or {@link #toBackendFilter}. Every step
 * returns a new instance.
 */
public class CenteredPattern {

    private final PatternExpression root;
    private final String center;
    private final TimeRange window;

    public CenteredPattern(PatternExpression root) {
        this(root, null, null);
    }

    private CenteredPattern(PatternExpression root, String center, TimeRange window) {
        this.root = root;
        this.center = center;
        this.window = window;
    }

    public PatternExpression getRoot() {
        return root;
    }

    /**
     * Bound center type, or null while unbound
     */
    public String getCenter() {
        return center;
    }

    /**
     * Union of the time bounds of every referenced variable, or null
     */
    public TimeRange getWindow() {
        return window;
    }

    public CenteredPattern bindCenter(String centerType) {
        if (center != null) {
            throw new InternalInvariantException(
                    "pattern center already bound to " + center + ", cannot rebind to " + centerType);
        }
        return new CenteredPattern(root.withCenter(centerType), centerType, window);
    }

    public CenteredPattern resolveReferences(ReferenceResolver resolver) {
        AtomicReference<TimeRange> merged = new AtomicReference<>(window);
        PatternExpression resolved = root.resolveReferences(resolver,
                range -> merged.updateAndGet(current -> current == null ? range : current.union(range)));
        return new CenteredPattern(resolved, center, merged.get());
    }

    public Set<Reference> getReferences() {
        Set<Reference> references = new LinkedHashSet<>();
        root.collectReferences(references);
        return references;
    }

    public Set<String> getReferencedVariables() {
        return getReferences().stream()
                .map(Reference::getVariable)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public String toWirePattern(TimeRange timeRange) {
        return toWirePattern(timeRange, RelationCatalog.standard());
    }

    /**
     * {@code [pattern]} with an optional {@code START t'..' STOP t'..'} suffix
     */
    public String toWirePattern(TimeRange timeRange, RelationCatalog catalog) {
        requireCenter();
        StringBuilder sb = new StringBuilder("[").append(root.toWire(center, catalog)).append(']');
        if (timeRange != null) {
            sb.append(" START ").append(PatternLiterals.toWire(timeRange.getStart()))
                    .append(" STOP ").append(PatternLiterals.toWire(timeRange.getStop()));
        }
        return sb.toString();
    }

    public StoreFilter toBackendFilter() {
        return toBackendFilter(RelationCatalog.standard());
    }

    public StoreFilter toBackendFilter(RelationCatalog catalog) {
        requireCenter();
        return root.toFilter(center, catalog);
    }

    private void requireCenter() {
        if (center == null) {
            throw new InternalInvariantException("pattern compiled before a center was bound: " + root);
        }
    }

    @Override
    public String toString() {
        return (center != null ? center + " " : "") + "[" + root + "]";
    }
}
