package com.huntflow.datasource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Routes queries to connectors by URI scheme and remembers which sources were queried,
 * most recent last.
 */
public class DataSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DataSourceRegistry.class);

    private static final String SCHEME_SEPARATOR = "://";

    private final Map<String, DataSourceConnector> connectors = new LinkedHashMap<>();
    private final LinkedList<String> queried = new LinkedList<>();

    public DataSourceRegistry(List<DataSourceConnector> connectors) {
        connectors.forEach(this::register);
    }

    public void register(DataSourceConnector connector) {
        connectors.put(connector.scheme().toLowerCase(Locale.ROOT), connector);
    }

    public Set<String> schemes() {
        return new TreeSet<>(connectors.keySet());
    }

    public List<String> listDataSources(String scheme) {
        DataSourceConnector connector = connectors.get(scheme.toLowerCase(Locale.ROOT));
        return connector != null ? connector.listDataSources() : Collections.emptyList();
    }

    /**
     * Query one URI, or several comma-separated URIs whose rows are concatenated
     */
    public List<Map<String, Object>> query(String uris, String wirePattern) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String uri : uris.split(",")) {
            String trimmed = uri.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            DataSourceConnector connector = connectorFor(trimmed);
            log.debug("Querying {} with {}", trimmed, wirePattern);
            rows.addAll(connector.query(trimmed, wirePattern));
            queried.remove(trimmed);
            queried.addLast(trimmed);
        }
        return rows;
    }

    /**
     * Most recently queried source URI
     */
    public Optional<String> lastQueried() {
        return queried.isEmpty() ? Optional.empty() : Optional.of(queried.getLast());
    }

    public List<String> queriedDataSources() {
        return Collections.unmodifiableList(queried);
    }

    private DataSourceConnector connectorFor(String uri) {
        int separator = uri.indexOf(SCHEME_SEPARATOR);
        if (separator <= 0) {
            throw new DataSourceException("data source URI has no scheme", uri);
        }
        String scheme = uri.substring(0, separator).toLowerCase(Locale.ROOT);
        DataSourceConnector connector = connectors.get(scheme);
        if (connector == null) {
            throw new DataSourceException("no connector registered for scheme " + scheme, uri);
        }
        return connector;
    }
}
