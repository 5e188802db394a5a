package com.huntflow.session;

import com.huntflow.statement.Command;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for huntflow execution.
 * Counts executed and failed statements per command and times whole blocks.
 */
@Component
public class SessionMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer blockLatency;
    private final Counter sessionsOpened;

    public SessionMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.blockLatency = Timer.builder("huntflow.block.latency")
                .description("Latency of huntflow block execution")
                .publishPercentiles(0.5, 0.95, 0.99)
                .minimumExpectedValue(Duration.ofMillis(1))
                .maximumExpectedValue(Duration.ofMinutes(10))
                .register(meterRegistry);
        this.sessionsOpened = Counter.builder("huntflow.session.opened")
                .description("Total number of huntflow sessions opened")
                .register(meterRegistry);
    }

    public void recordSessionOpened() {
        sessionsOpened.increment();
    }

    public void recordStatementExecuted(Command command) {
        statementCounter("huntflow.statement.executed", "Statements executed", command).increment();
    }

    public void recordStatementFailed(Command command) {
        statementCounter("huntflow.statement.failed", "Statements that failed", command).increment();
    }

    public Timer.Sample startBlockTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordBlockLatency(Timer.Sample sample) {
        sample.stop(blockLatency);
    }

    // Getter methods for testing
    public Counter getStatementsExecuted(Command command) {
        return statementCounter("huntflow.statement.executed", "Statements executed", command);
    }

    public Counter getStatementsFailed(Command command) {
        return statementCounter("huntflow.statement.failed", "Statements that failed", command);
    }

    public Timer getBlockLatency() {
        return blockLatency;
    }

    public Counter getSessionsOpened() {
        return sessionsOpened;
    }

    private Counter statementCounter(String name, String description, Command command) {
        return Counter.builder(name)
                .description(description)
                .tag("command", command.keyword())
                .register(meterRegistry);
    }
}
