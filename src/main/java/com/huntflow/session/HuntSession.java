package com.huntflow.session;

import com.huntflow.HuntflowException;
import com.huntflow.analytics.AnalyticsRegistry;
import com.huntflow.commands.CommandRegistry;
import com.huntflow.commands.CommandResult;
import com.huntflow.completion.CompletionEngine;
import com.huntflow.datasource.DataSourceRegistry;
import com.huntflow.display.BlockSummaryDisplay;
import com.huntflow.display.Display;
import com.huntflow.pattern.InvalidPatternException;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.semantics.SemanticResolver;
import com.huntflow.statement.NewStatement;
import com.huntflow.statement.Statement;
import com.huntflow.store.EntityStore;
import com.huntflow.store.StorePatternException;
import com.huntflow.syntax.StatementParser;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A hunting session: the symbol table and entity store that huntflow blocks run against.
 *
 * <p>Blocks execute statement by statement, fail-fast and without rollback: bindings made
 * before a failing statement stay in place. A session owns a temporary runtime directory
 * and releases it, together with the store, on {@link #close()} or at JVM shutdown.
 * Sessions are single-threaded.
 */
public class HuntSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HuntSession.class);

    private final String sessionId = UUID.randomUUID().toString();
    private final SessionConfig config;
    private final StatementParser parser;
    private final SemanticResolver resolver;
    private final EntityStore store;
    private final SymbolTable symbolTable;
    private final RelationCatalog catalog;
    private final DataSourceRegistry dataSources;
    private final AnalyticsRegistry analytics;
    private final CommandRegistry commands;
    private final SessionMetrics metrics;
    private final CompletionEngine completionEngine = new CompletionEngine();
    private final Path runtimeDirectory;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Thread shutdownHook;

    public HuntSession(SessionConfig config, StatementParser parser, EntityStore store, RelationCatalog catalog,
                       DataSourceRegistry dataSources, AnalyticsRegistry analytics, CommandRegistry commands,
                       SessionMetrics metrics) {
        this.config = config;
        this.parser = parser;
        this.store = store;
        this.catalog = catalog;
        this.dataSources = dataSources;
        this.analytics = analytics;
        this.commands = commands;
        this.metrics = metrics;
        this.symbolTable = new SymbolTable(config.getDefaultVariable());
        this.resolver = new SemanticResolver(config, catalog, dataSources);
        try {
            this.runtimeDirectory = Files.createTempDirectory(config.getRuntimeDirectoryPrefix());
        } catch (IOException e) {
            log.error("Failed to create session runtime directory: {}", e.getMessage());
            throw new HuntflowException("cannot create session runtime directory", e);
        }
        this.shutdownHook = new Thread(this::close, "huntflow-session-" + sessionId);
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        metrics.recordSessionOpened();
        log.info("Opened session {} with runtime directory {}", sessionId, runtimeDirectory);
    }

    /**
     * Parse and run a huntflow block.
     *
     * @return the displays produced by the statements, followed by a block summary when
     *         enabled and the block created variables
     */
    public List<Display> execute(String block) {
        ensureOpen();
        long started = System.nanoTime();
        Timer.Sample sample = metrics.startBlockTimer();
        List<Display> displays = new ArrayList<>();
        Set<String> newVariables = new LinkedHashSet<>();

        for (Statement statement : parse(block)) {
            run(statement, displays, newVariables);
        }

        metrics.recordBlockLatency(sample);
        if (config.isShowExecutionSummary() && !newVariables.isEmpty()) {
            long seconds = (long) Math.ceil((System.nanoTime() - started) / (double) TimeUnit.SECONDS.toNanos(1));
            List<BlockSummaryDisplay.Entry> entries = newVariables.stream()
                    .map(name -> {
                        VariableBinding binding = symbolTable.require(name);
                        return new BlockSummaryDisplay.Entry(name, binding.getEntityType(), binding.getCount());
                    })
                    .collect(Collectors.toList());
            displays.add(new BlockSummaryDisplay(entries, seconds));
        }
        return displays;
    }

    /**
     * Parse a block without executing it
     */
    public List<Statement> parse(String block) {
        return parser.parse(block, config);
    }

    private void run(Statement statement, List<Display> displays, Set<String> newVariables) {
        log.debug("Executing {}", statement);
        CommandResult result;
        try {
            resolver.resolve(statement, symbolTable);
            result = commands.getHandler(statement.getCommand()).handle(statement, this);
        } catch (StorePatternException e) {
            metrics.recordStatementFailed(statement.getCommand());
            log.warn("Backend rejected pattern {}: {}", e.getPattern(), e.getMessage());
            throw new InvalidPatternException(e.getMessage(), e.getPattern(), e);
        } catch (RuntimeException e) {
            metrics.recordStatementFailed(statement.getCommand());
            throw e;
        }
        metrics.recordStatementExecuted(statement.getCommand());

        result.getBinding().ifPresent(binding -> {
            String output = statement.getOutput();
            symbolTable.bind(output, binding);
            if (!output.equals(config.getDefaultVariable())) {
                // a rebound name moves to the end
                newVariables.remove(output);
                newVariables.add(output);
            }
        });
        result.getDisplay().ifPresent(displays::add);
    }

    public List<String> getVariableNames() {
        return symbolTable.names();
    }

    /**
     * Rows of a variable
     */
    public List<Map<String, Object>> getVariable(String name) {
        ensureOpen();
        return symbolTable.require(name).getRows();
    }

    /**
     * Programmatic NEW: bind {@code name} to entities built from objects or plain values.
     *
     * @param entityType overrides the {@code type} field of objects; required for plain values
     */
    public void createVariable(String name, List<?> objects, String entityType) {
        ensureOpen();
        NewStatement statement = new NewStatement(entityType, new ArrayList<>(objects));
        statement.setOutput(name);
        run(statement, new ArrayList<>(), new LinkedHashSet<>());
    }

    /**
     * Completion candidates for the partial word before {@code cursor}, with the typed
     * part stripped
     */
    public List<String> doComplete(String code, int cursor) {
        ensureOpen();
        return completionEngine.complete(code, cursor, this);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing session {}", sessionId);
        try {
            store.close();
        } finally {
            deleteRuntimeDirectory();
            removeShutdownHook();
        }
    }

    private void deleteRuntimeDirectory() {
        if (!Files.exists(runtimeDirectory)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(runtimeDirectory)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            log.warn("Failed to list runtime directory {}: {}", runtimeDirectory, e.getMessage());
            return;
        }
        for (Path path : paths) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Failed to delete {}: {}", path, e.getMessage());
            }
        }
    }

    private void removeShutdownHook() {
        if (Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down, keeping hook for session {}", sessionId);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("session " + sessionId + " is closed");
        }
    }

    public String getSessionId() {
        return sessionId;
    }

    public SessionConfig getConfig() {
        return config;
    }

    public EntityStore getStore() {
        return store;
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public RelationCatalog getCatalog() {
        return catalog;
    }

    public DataSourceRegistry getDataSources() {
        return dataSources;
    }

    public AnalyticsRegistry getAnalytics() {
        return analytics;
    }

    public StatementParser getParser() {
        return parser;
    }

    public Path getRuntimeDirectory() {
        return runtimeDirectory;
    }
}
