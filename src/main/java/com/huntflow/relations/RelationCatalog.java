package com.huntflow.relations;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.huntflow.InternalInvariantException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Static relation table between entity types.
 *
 * <p>Answers two questions: whether {@code (x, relation, y)} is a valid FIND, and through
 * which reference attributes an entity of one type reaches an entity of another type.
 */
public class RelationCatalog {

    private static final Logger log = LoggerFactory.getLogger(RelationCatalog.class);

    public static final String RESOURCE = "stix-relations.yaml";

    private static volatile RelationCatalog standard;

    private final List<String> entityTypes;
    private final Set<String> genericRelations;
    private final Map<String, RefMapping> mappings;

    public RelationCatalog(List<String> entityTypes, Set<String> genericRelations, List<RefMapping> mappings) {
        this.entityTypes = List.copyOf(entityTypes);
        this.genericRelations = Set.copyOf(genericRelations);
        this.mappings = mappings.stream()
                .collect(Collectors.toMap(
                        m -> key(m.getSubject(), m.getRelation(), m.getObject()),
                        Function.identity(),
                        (a, b) -> a,
                        LinkedHashMap::new));
    }

    /**
     * Catalog loaded from the bundled {@value #RESOURCE}
     */
    public static RelationCatalog standard() {
        RelationCatalog catalog = standard;
        if (catalog == null) {
            synchronized (RelationCatalog.class) {
                if (standard == null) {
                    standard = load();
                }
                catalog = standard;
            }
        }
        return catalog;
    }

    public static RelationCatalog load() {
        try (InputStream in = RelationCatalog.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new InternalInvariantException("missing classpath resource " + RESOURCE);
            }
            RelationCatalogDocument doc = new YAMLMapper().readValue(in, RelationCatalogDocument.class);
            log.debug("Loaded {} relation mappings and {} entity types",
                    doc.getRefMappings().size(), doc.getEntityTypes().size());
            return new RelationCatalog(doc.getEntityTypes(), new LinkedHashSet<>(doc.getGenericRelations()),
                    doc.getRefMappings());
        } catch (IOException e) {
            log.error("Failed to read relation catalog {}: {}", RESOURCE, e.getMessage());
            throw new UncheckedIOException(e);
        }
    }

    public List<String> getEntityTypes() {
        return entityTypes;
    }

    public boolean isGeneric(String relation) {
        return genericRelations.contains(relation);
    }

    public Optional<RefMapping> lookup(String subjectType, String relation, String objectType) {
        return Optional.ofNullable(mappings.get(key(subjectType, relation, objectType)));
    }

    /**
     * Whether FIND may traverse {@code subject relation object}
     */
    public boolean supports(String subjectType, String relation, String objectType) {
        return mappings.containsKey(key(subjectType, relation, objectType)) || isGeneric(relation);
    }

    /**
     * Every relation name known to the catalog, sorted
     */
    public List<String> relationNames() {
        Set<String> names = new TreeSet<>(genericRelations);
        mappings.values().forEach(m -> names.add(m.getRelation()));
        return new ArrayList<>(names);
    }

    /**
     * Reference attributes on {@code fromType} that point at entities of {@code toType},
     * collected across every relation in either direction
     */
    public List<String> pathsBetween(String fromType, String toType) {
        Set<String> paths = new LinkedHashSet<>();
        for (RefMapping m : mappings.values()) {
            if (m.getSubject().equals(fromType) && m.getObject().equals(toType)) {
                paths.addAll(m.getSubjectRefs());
            }
            if (m.getObject().equals(fromType) && m.getSubject().equals(toType)) {
                paths.addAll(m.getObjectRefs());
            }
        }
        return paths.isEmpty() ? Collections.emptyList() : new ArrayList<>(paths);
    }

    private static String key(String subject, String relation, String object) {
        return subject + "|" + relation + "|" + object;
    }
}
