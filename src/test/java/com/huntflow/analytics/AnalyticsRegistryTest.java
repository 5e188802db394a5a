package com.huntflow.analytics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.huntflow.commands.CommandRegistry;
import com.huntflow.datasource.DataSourceRegistry;
import com.huntflow.display.Display;
import com.huntflow.display.DisplayRows;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.session.HuntSession;
import com.huntflow.session.SessionConfig;
import com.huntflow.session.SessionMetrics;
import com.huntflow.store.InMemoryEntityStore;
import com.huntflow.syntax.StatementParser;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AnalyticsRegistry and APPLY execution through a session
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsRegistryTest {

    @Mock
    private AnalyticsInterface python;

    private HuntSession session;

    @BeforeEach
    void setUp() {
        when(python.scheme()).thenReturn("python");
        ObjectMapper objectMapper = new ObjectMapper();
        session = new HuntSession(SessionConfig.defaults(), new StatementParser(), new InMemoryEntityStore(),
                RelationCatalog.standard(), new DataSourceRegistry(List.of()),
                new AnalyticsRegistry(List.of(python)), CommandRegistry.standard(objectMapper),
                new SessionMetrics(new SimpleMeterRegistry()));
        session.execute("procs = NEW process [{\"name\": \"cmd.exe\"}, {\"name\": \"calc.exe\"}]");
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void testApply_passesInputsAndDereferencedArguments() {
        // Given: An analytics that returns a table
        Display table = new DisplayRows(List.of(Map.of("score", 0.9)));
        when(python.execute(eq("python://score"), anyList(), anyMap(), any(HuntSession.class)))
                .thenReturn(Optional.of(table));

        // When: Applying it with a reference argument
        List<Display> displays = session.execute("APPLY python://score ON procs WITH names = procs.name, depth = 2");

        // Then: The display is returned and arguments carry values
        assertThat(displays).containsExactly(table);
        ArgumentCaptor<Map<String, Object>> arguments = ArgumentCaptor.forClass(Map.class);
        verify(python).execute(eq("python://score"), eq(List.of("procs")), arguments.capture(), eq(session));
        assertThat(arguments.getValue())
                .containsEntry("names", List.of("cmd.exe", "calc.exe"))
                .containsEntry("depth", 2L);
    }

    @Test
    void testApply_withoutDisplayProducesNothing() {
        when(python.execute(anyString(), anyList(), anyMap(), any(HuntSession.class))).thenReturn(Optional.empty());

        assertThat(session.execute("APPLY python://enrich ON procs")).isEmpty();
    }

    @Test
    void testExecute_unknownSchemeIsRejected() {
        AnalyticsRegistry registry = session.getAnalytics();

        assertThatThrownBy(() -> registry.execute("docker://scan", List.of("procs"), Map.of(), session))
                .isInstanceOf(AnalyticsException.class)
                .hasMessageContaining("docker");
        assertThatThrownBy(() -> registry.execute("scan", List.of("procs"), Map.of(), session))
                .isInstanceOf(AnalyticsException.class);
        verify(python, never()).execute(anyString(), anyList(), anyMap(), any(HuntSession.class));
    }

    @Test
    void testListAnalytics_byScheme() {
        when(python.listAnalytics()).thenReturn(List.of("enrich", "score"));
        AnalyticsRegistry registry = session.getAnalytics();

        assertThat(registry.schemes()).containsExactly("python");
        assertThat(registry.listAnalytics("PYTHON")).containsExactly("enrich", "score");
        assertThat(registry.listAnalytics("docker")).isEmpty();
    }
}
