package com.huntflow.store;

import java.util.Objects;

/**
 * Opaque reference to a result set held by an {@link EntityStore}
 */
public class ResultSetHandle {
    private final String id;
    private final String entityType;

    public ResultSetHandle(String id, String entityType) {
        this.id = Objects.requireNonNull(id, "id");
        this.entityType = Objects.requireNonNull(entityType, "entityType");
    }

    public String getId() {
        return id;
    }

    public String getEntityType() {
        return entityType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultSetHandle)) return false;
        ResultSetHandle that = (ResultSetHandle) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return entityType + "@" + id;
    }
}
