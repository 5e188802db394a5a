package com.huntflow.syntax;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.statement.TimeRange;

/**
 * A stand-alone wire pattern with its optional START/STOP qualifier
 */
public class ParsedPattern {
    private final CenteredPattern pattern;
    private final TimeRange timeRange;

    public ParsedPattern(CenteredPattern pattern, TimeRange timeRange) {
        this.pattern = pattern;
        this.timeRange = timeRange;
    }

    public CenteredPattern getPattern() {
        return pattern;
    }

    /**
     * Qualifier window, or null when the pattern had none
     */
    public TimeRange getTimeRange() {
        return timeRange;
    }
}
