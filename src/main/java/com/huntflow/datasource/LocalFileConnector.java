package com.huntflow.datasource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.pattern.Comparison;
import com.huntflow.pattern.Junction;
import com.huntflow.pattern.PatternExpression;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.EntityRows;
import com.huntflow.store.LinkedRowView;
import com.huntflow.store.RowValues;
import com.huntflow.store.StoreFilter;
import com.huntflow.store.StorePatternException;
import com.huntflow.syntax.HuntflowSyntaxException;
import com.huntflow.syntax.ParsedPattern;
import com.huntflow.syntax.StatementParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Serves {@code file://} URIs pointing at local JSON entity bundles.
 *
 * <p>A bundle is either a JSON array of entities, a STIX-style object with an
 * {@code objects} array, or an object mapping entity types to entity arrays. Entities
 * carry {@code type} (implied by the key in the last form) and may reference each
 * other by {@code id} through {@code *_ref} / {@code *_refs} attributes.
 */
public class LocalFileConnector implements DataSourceConnector {

    private static final Logger log = LoggerFactory.getLogger(LocalFileConnector.class);

    public static final String SCHEME = "file";
    private static final String PREFIX = SCHEME + "://";
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final List<String> bundles;
    private final StatementParser parser;
    private final ObjectMapper objectMapper;

    /**
     * @param bundles bundle paths advertised by {@link #listDataSources()}
     */
    public LocalFileConnector(List<String> bundles, StatementParser parser, ObjectMapper objectMapper) {
        this.bundles = List.copyOf(bundles);
        this.parser = parser;
        this.objectMapper = objectMapper;
    }

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public List<String> listDataSources() {
        return bundles;
    }

    @Override
    public List<Map<String, Object>> query(String uri, String wirePattern) {
        // Compile the wire pattern back into a row filter
        ParsedPattern parsed;
        try {
            parsed = parser.parsePattern(wirePattern);
        } catch (HuntflowSyntaxException e) {
            throw new StorePatternException("malformed pattern: " + e.getMessage(), wirePattern, e);
        }
        String center = leadingType(parsed.getPattern().getRoot());
        if (center == null) {
            throw new StorePatternException("pattern names no entity type", wirePattern);
        }
        StoreFilter filter = parsed.getPattern().bindCenter(center).toBackendFilter();

        // Load the bundle and index every entity by id for reference paths
        List<Map<String, Object>> entities = readBundle(uri);
        Map<Object, Map<String, Object>> byId = new HashMap<>();
        entities.forEach(row -> byId.put(row.get(EntityRows.ID), row));

        List<Map<String, Object>> matches = new ArrayList<>();
        for (Map<String, Object> row : entities) {
            if (center.equals(row.get(EntityRows.TYPE))
                    && within(row, parsed.getTimeRange())
                    && filter.test(new LinkedRowView(row, byId::get))) {
                matches.add(row);
            }
        }
        log.debug("{} of {} entities in {} match {}", matches.size(), entities.size(), uri, wirePattern);
        return matches;
    }

    List<Map<String, Object>> readBundle(String uri) {
        Path path = toPath(uri);
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(path)) {
            root = objectMapper.readTree(reader);
        } catch (IOException e) {
            log.error("Failed to read bundle {}: {}", path, e.getMessage());
            throw new DataSourceException("cannot read bundle " + path, uri, e);
        }
        List<Map<String, Object>> entities = new ArrayList<>();
        if (root.isArray()) {
            root.forEach(node -> entities.add(toRow(node, null)));
        } else if (root.has("objects") && root.get("objects").isArray()) {
            root.get("objects").forEach(node -> entities.add(toRow(node, null)));
        } else if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                field.getValue().forEach(node -> entities.add(toRow(node, field.getKey())));
            }
        } else {
            throw new DataSourceException("bundle is neither a JSON array nor an object", uri);
        }
        return entities;
    }

    private Map<String, Object> toRow(JsonNode node, String impliedType) {
        Map<String, Object> row = EntityRows.flatten(objectMapper.convertValue(node, ROW_TYPE));
        if (impliedType != null) {
            row.putIfAbsent(EntityRows.TYPE, impliedType);
        }
        return EntityRows.withId(String.valueOf(row.get(EntityRows.TYPE)), row);
    }

    static Path toPath(String uri) {
        if (!uri.startsWith(PREFIX)) {
            throw new DataSourceException("not a file URI", uri);
        }
        String location = uri.substring(PREFIX.length());
        if (location.isEmpty()) {
            throw new DataSourceException("file URI has no path", uri);
        }
        return Paths.get(location).toAbsolutePath().normalize();
    }

    private static boolean within(Map<String, Object> row, TimeRange range) {
        if (range == null) {
            return true;
        }
        Instant observed = RowValues.toInstant(row.get(EntityRows.FIRST_OBSERVED));
        return observed == null || (!observed.isBefore(range.getStart()) && !observed.isAfter(range.getStop()));
    }

    private static String leadingType(PatternExpression expression) {
        PatternExpression node = expression;
        while (node instanceof Junction) {
            node = ((Junction) node).getLeft();
        }
        return node instanceof Comparison ? ((Comparison) node).getEntityType() : null;
    }
}
