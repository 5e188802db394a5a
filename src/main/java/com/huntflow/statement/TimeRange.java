package com.huntflow.statement;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Represents a time range for pattern filtering
 */
public class TimeRange {
    private final Instant start;
    private final Instant stop;

    public TimeRange(Instant start, Instant stop) {
        this.start = Objects.requireNonNull(start, "start");
        this.stop = Objects.requireNonNull(stop, "stop");
    }

    public Instant getStart() {
        return start;
    }

    public Instant getStop() {
        return stop;
    }

    /**
     * Smallest range covering both this range and the other one
     */
    public TimeRange union(TimeRange other) {
        if (other == null) {
            return this;
        }
        Instant earliest = start.isBefore(other.start) ? start : other.start;
        Instant latest = stop.isAfter(other.stop) ? stop : other.stop;
        return new TimeRange(earliest, latest);
    }

    public TimeRange widen(Duration startOffset, Duration stopOffset) {
        return new TimeRange(start.plus(startOffset), stop.plus(stopOffset));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) o;
        return start.equals(that.start) && stop.equals(that.stop);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, stop);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + stop + "]";
    }
}
