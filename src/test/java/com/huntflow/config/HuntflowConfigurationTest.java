package com.huntflow.config;

import com.huntflow.analytics.AnalyticsInterface;
import com.huntflow.datasource.LocalFileConnector;
import com.huntflow.session.HuntSession;
import com.huntflow.session.HuntSessionFactory;
import com.huntflow.session.SessionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Integration tests for the huntflow Spring wiring
 */
@SpringBootTest(properties = {
        "huntflow.runner.enabled=false",
        "huntflow.language.default-sort-order=asc",
        "huntflow.datasource.local-bundles=/data/a.json, /data/b.json"
})
@DisplayName("Huntflow Configuration Integration Tests")
class HuntflowConfigurationTest {

    @Autowired
    private SessionConfig sessionConfig;

    @Autowired
    private LocalFileConnector localFileConnector;

    @Autowired
    private HuntSessionFactory sessionFactory;

    @MockBean
    private AnalyticsInterface analytics;

    @BeforeEach
    void setUp() {
        when(analytics.scheme()).thenReturn("python");
    }

    @Test
    @DisplayName("Should bind session settings from properties")
    void shouldBindSessionSettings() {
        assertThat(sessionConfig.getDefaultVariable()).isEqualTo("_");
        assertThat(sessionConfig.getDefaultSortOrder()).isEqualTo("ASC");
        assertThat(sessionConfig.isShowExecutionSummary()).isTrue();
        assertThat(sessionConfig.getTimerangeStartOffset()).isEqualTo(Duration.ofSeconds(-300));
        assertThat(sessionConfig.getTimerangeStopOffset()).isEqualTo(Duration.ofSeconds(300));
    }

    @Test
    @DisplayName("Should trim configured local bundles")
    void shouldTrimLocalBundles() {
        assertThat(localFileConnector.listDataSources()).containsExactly("/data/a.json", "/data/b.json");
    }

    @Test
    @DisplayName("Should create isolated sessions wired with connectors and analytics")
    void shouldCreateIsolatedSessions() {
        try (HuntSession first = sessionFactory.create(); HuntSession second = sessionFactory.create()) {
            first.execute("ips = NEW ipv4-addr [\"10.0.0.1\"]");

            assertThat(first.getVariableNames()).contains("ips");
            assertThat(second.getVariableNames()).isEmpty();
            assertThat(first.getDataSources().schemes()).containsExactly("file");
            assertThat(first.getAnalytics().schemes()).containsExactly("python");
            assertThat(first.getSessionId()).isNotEqualTo(second.getSessionId());
        }
    }
}
