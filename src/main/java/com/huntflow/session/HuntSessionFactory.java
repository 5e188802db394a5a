package com.huntflow.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.analytics.AnalyticsInterface;
import com.huntflow.analytics.AnalyticsRegistry;
import com.huntflow.commands.CommandRegistry;
import com.huntflow.datasource.DataSourceConnector;
import com.huntflow.datasource.DataSourceRegistry;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.store.EntityStore;
import com.huntflow.store.InMemoryEntityStore;
import com.huntflow.syntax.StatementParser;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Creates sessions wired with the configured connectors and analytics.
 * Each session gets its own registries so queried-source history is per session.
 */
@Component
public class HuntSessionFactory {

    private final SessionConfig config;
    private final StatementParser parser;
    private final RelationCatalog catalog;
    private final ObjectProvider<DataSourceConnector> connectors;
    private final ObjectProvider<AnalyticsInterface> analytics;
    private final ObjectMapper objectMapper;
    private final SessionMetrics metrics;

    public HuntSessionFactory(SessionConfig config, StatementParser parser, RelationCatalog catalog,
                              ObjectProvider<DataSourceConnector> connectors,
                              ObjectProvider<AnalyticsInterface> analytics,
                              ObjectMapper objectMapper, SessionMetrics metrics) {
        this.config = config;
        this.parser = parser;
        this.catalog = catalog;
        this.connectors = connectors;
        this.analytics = analytics;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    public HuntSession create() {
        return create(new InMemoryEntityStore());
    }

    public HuntSession create(EntityStore store) {
        return new HuntSession(config, parser, store, catalog,
                new DataSourceRegistry(connectors.orderedStream().collect(Collectors.toList())),
                new AnalyticsRegistry(analytics.orderedStream().collect(Collectors.toList())),
                CommandRegistry.standard(objectMapper),
                metrics);
    }
}
