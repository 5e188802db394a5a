package com.huntflow.relations;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * YAML layout of {@code stix-relations.yaml}
 */
public class RelationCatalogDocument {

    @JsonProperty("entity-types")
    private List<String> entityTypes = new ArrayList<>();

    @JsonProperty("generic-relations")
    private List<String> genericRelations = new ArrayList<>();

    @JsonProperty("ref-mappings")
    private List<RefMapping> refMappings = new ArrayList<>();

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public List<String> getGenericRelations() {
        return genericRelations;
    }

    public List<RefMapping> getRefMappings() {
        return refMappings;
    }
}
