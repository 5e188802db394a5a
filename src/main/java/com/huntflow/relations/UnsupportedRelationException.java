package com.huntflow.relations;

import com.huntflow.HuntflowException;

/**
 * Thrown when two entity types are not connected by the requested relation
 * (or by any reference path, when rewriting a pattern)
 */
public class UnsupportedRelationException extends HuntflowException {

    private final String subjectType;
    private final String relation;
    private final String objectType;

    public UnsupportedRelationException(String subjectType, String relation, String objectType) {
        super("unsupported relation " + subjectType + " " + relation + " " + objectType);
        this.subjectType = subjectType;
        this.relation = relation;
        this.objectType = objectType;
    }

    /**
     * No reference path leads from {@code fromType} to {@code toType}
     */
    public UnsupportedRelationException(String fromType, String toType) {
        super("no reference path from " + fromType + " to " + toType);
        this.subjectType = fromType;
        this.relation = null;
        this.objectType = toType;
    }

    public String getSubjectType() {
        return subjectType;
    }

    public String getRelation() {
        return relation;
    }

    public String getObjectType() {
        return objectType;
    }
}
