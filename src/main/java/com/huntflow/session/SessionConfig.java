package com.huntflow.session;

import java.time.Duration;
import java.util.Locale;

/**
 * Immutable per-session settings threaded through parsing, resolution and execution
 */
public class SessionConfig {

    public static final String DEFAULT_VARIABLE = "_";
    public static final String DEFAULT_SORT_ORDER = "DESC";

    private final String defaultVariable;
    private final String defaultSortOrder;
    private final boolean showExecutionSummary;
    private final String runtimeDirectoryPrefix;
    private final Duration timerangeStartOffset;
    private final Duration timerangeStopOffset;

    public SessionConfig(String defaultVariable, String defaultSortOrder, boolean showExecutionSummary,
                         String runtimeDirectoryPrefix, Duration timerangeStartOffset,
                         Duration timerangeStopOffset) {
        this.defaultVariable = defaultVariable;
        this.defaultSortOrder = defaultSortOrder.toUpperCase(Locale.ROOT);
        this.showExecutionSummary = showExecutionSummary;
        this.runtimeDirectoryPrefix = runtimeDirectoryPrefix;
        this.timerangeStartOffset = timerangeStartOffset;
        this.timerangeStopOffset = timerangeStopOffset;
        if (!"ASC".equals(this.defaultSortOrder) && !"DESC".equals(this.defaultSortOrder)) {
            throw new IllegalArgumentException("default sort order must be ASC or DESC: " + defaultSortOrder);
        }
    }

    public static SessionConfig defaults() {
        return new SessionConfig(DEFAULT_VARIABLE, DEFAULT_SORT_ORDER, true, "huntflow-session-",
                Duration.ofSeconds(-300), Duration.ofSeconds(300));
    }

    /**
     * Name that always aliases the most recently produced binding
     */
    public String getDefaultVariable() {
        return defaultVariable;
    }

    public String getDefaultSortOrder() {
        return defaultSortOrder;
    }

    public boolean isDefaultSortAscending() {
        return "ASC".equals(defaultSortOrder);
    }

    public boolean isShowExecutionSummary() {
        return showExecutionSummary;
    }

    public String getRuntimeDirectoryPrefix() {
        return runtimeDirectoryPrefix;
    }

    /**
     * Added to the start of a reference-derived window, usually negative
     */
    public Duration getTimerangeStartOffset() {
        return timerangeStartOffset;
    }

    public Duration getTimerangeStopOffset() {
        return timerangeStopOffset;
    }

    public SessionConfig withShowExecutionSummary(boolean show) {
        return new SessionConfig(defaultVariable, defaultSortOrder, show, runtimeDirectoryPrefix,
                timerangeStartOffset, timerangeStopOffset);
    }
}
