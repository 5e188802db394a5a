package com.huntflow.relations;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code (subject, relation, object)} entry of the relation table with the
 * reference attributes that realize it on either side
 */
public class RefMapping {

    @JsonProperty("subject")
    private String subject;

    @JsonProperty("relation")
    private String relation;

    @JsonProperty("object")
    private String object;

    @JsonProperty("subject-refs")
    private List<String> subjectRefs = new ArrayList<>();

    @JsonProperty("object-refs")
    private List<String> objectRefs = new ArrayList<>();

    public RefMapping() {
    }

    public RefMapping(String subject, String relation, String object, List<String> subjectRefs,
                      List<String> objectRefs) {
        this.subject = subject;
        this.relation = relation;
        this.object = object;
        this.subjectRefs = subjectRefs;
        this.objectRefs = objectRefs;
    }

    public String getSubject() {
        return subject;
    }

    public String getRelation() {
        return relation;
    }

    public String getObject() {
        return object;
    }

    /**
     * Attributes of the subject holding object ids
     */
    public List<String> getSubjectRefs() {
        return subjectRefs;
    }

    /**
     * Attributes of the object holding subject ids
     */
    public List<String> getObjectRefs() {
        return objectRefs;
    }

    @Override
    public String toString() {
        return "(" + subject + ", " + relation + ", " + object + ")";
    }
}
