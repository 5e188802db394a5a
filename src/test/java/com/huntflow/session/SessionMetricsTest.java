package com.huntflow.session;

import com.huntflow.statement.Command;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionMetrics Tests")
class SessionMetricsTest {

    private MeterRegistry meterRegistry;
    private SessionMetrics sessionMetrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        sessionMetrics = new SessionMetrics(meterRegistry);
    }

    @Test
    @DisplayName("Should count executed statements per command")
    void shouldCountExecutedStatementsPerCommand() {
        sessionMetrics.recordStatementExecuted(Command.GET);
        sessionMetrics.recordStatementExecuted(Command.GET);
        sessionMetrics.recordStatementExecuted(Command.DISP);

        assertThat(sessionMetrics.getStatementsExecuted(Command.GET).count()).isEqualTo(2.0);
        assertThat(sessionMetrics.getStatementsExecuted(Command.DISP).count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("huntflow.statement.executed").tag("command", "get").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should count failed statements separately")
    void shouldCountFailedStatements() {
        sessionMetrics.recordStatementFailed(Command.FIND);

        assertThat(sessionMetrics.getStatementsFailed(Command.FIND).count()).isEqualTo(1.0);
        assertThat(sessionMetrics.getStatementsExecuted(Command.FIND).count()).isZero();
    }

    @Test
    @DisplayName("Should record block latency")
    void shouldRecordBlockLatency() {
        Timer.Sample sample = sessionMetrics.startBlockTimer();

        sessionMetrics.recordBlockLatency(sample);

        assertThat(sessionMetrics.getBlockLatency().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should count opened sessions")
    void shouldCountOpenedSessions() {
        sessionMetrics.recordSessionOpened();
        sessionMetrics.recordSessionOpened();

        assertThat(sessionMetrics.getSessionsOpened().count()).isEqualTo(2.0);
    }
}
