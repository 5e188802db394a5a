package com.huntflow.session;

import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.EntityStore;
import com.huntflow.store.ResultSetHandle;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a variable name is bound to: a typed result set in the store.
 *
 * <p>Row count and time bounds are computed on first use and memoized; result sets never
 * change once created.
 */
public class VariableBinding {

    private final String entityType;
    private final ResultSetHandle handle;
    private final EntityStore store;

    private Long count;
    private Optional<TimeRange> timeBounds;

    public VariableBinding(ResultSetHandle handle, EntityStore store) {
        this.entityType = handle.getEntityType();
        this.handle = handle;
        this.store = store;
    }

    public String getEntityType() {
        return entityType;
    }

    public ResultSetHandle getHandle() {
        return handle;
    }

    public long getCount() {
        if (count == null) {
            count = store.count(handle);
        }
        return count;
    }

    public Optional<TimeRange> getTimeBounds() {
        if (timeBounds == null) {
            timeBounds = store.timeBounds(handle);
        }
        return timeBounds;
    }

    /**
     * Distinct values of an attribute across the rows
     */
    public List<Object> getValues(String attribute) {
        return store.values(handle, attribute);
    }

    public List<Map<String, Object>> getRows() {
        return store.rows(handle, AttributeSelector.all());
    }

    @Override
    public String toString() {
        return entityType + " " + handle.getId();
    }
}
