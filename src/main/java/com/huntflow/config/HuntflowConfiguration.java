package com.huntflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.huntflow.datasource.LocalFileConnector;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.session.SessionConfig;
import com.huntflow.syntax.StatementParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration for huntflow sessions.
 * Binds {@code huntflow.*} properties into an immutable {@link SessionConfig} and
 * provides the parser, relation catalog, JSON mapper and the local file connector.
 */
@Configuration
public class HuntflowConfiguration {
    private static final Logger log = LoggerFactory.getLogger(HuntflowConfiguration.class);

    @Value("${huntflow.language.default-variable:_}")
    private String defaultVariable;

    @Value("${huntflow.language.default-sort-order:DESC}")
    private String defaultSortOrder;

    @Value("${huntflow.session.show-execution-summary:true}")
    private boolean showExecutionSummary;

    @Value("${huntflow.session.runtime-directory-prefix:huntflow-session-}")
    private String runtimeDirectoryPrefix;

    @Value("${huntflow.pattern.timerange-start-offset:-300}")
    private long timerangeStartOffsetSeconds;

    @Value("${huntflow.pattern.timerange-stop-offset:300}")
    private long timerangeStopOffsetSeconds;

    @Value("${huntflow.datasource.local-bundles:}")
    private List<String> localBundles;

    @Bean
    public SessionConfig sessionConfig() {
        SessionConfig config = new SessionConfig(defaultVariable, defaultSortOrder, showExecutionSummary,
                runtimeDirectoryPrefix, Duration.ofSeconds(timerangeStartOffsetSeconds),
                Duration.ofSeconds(timerangeStopOffsetSeconds));
        log.info("Huntflow session config: default variable {}, default sort {}, window offsets {}s/{}s",
                defaultVariable, config.getDefaultSortOrder(), timerangeStartOffsetSeconds, timerangeStopOffsetSeconds);
        return config;
    }

    @Bean
    public StatementParser statementParser() {
        return new StatementParser();
    }

    @Bean
    public RelationCatalog relationCatalog() {
        return RelationCatalog.standard();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public LocalFileConnector localFileConnector(StatementParser statementParser, ObjectMapper objectMapper) {
        List<String> bundles = localBundles == null ? List.of() : localBundles.stream()
                .map(String::trim)
                .filter(bundle -> !bundle.isEmpty())
                .collect(Collectors.toList());
        return new LocalFileConnector(bundles, statementParser, objectMapper);
    }
}
