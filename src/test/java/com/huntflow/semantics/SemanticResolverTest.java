package com.huntflow.semantics;

import com.huntflow.InternalInvariantException;
import com.huntflow.datasource.DataSourceRegistry;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.relations.UnsupportedRelationException;
import com.huntflow.session.SessionConfig;
import com.huntflow.session.SymbolTable;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.ApplyStatement;
import com.huntflow.statement.DispStatement;
import com.huntflow.statement.FindStatement;
import com.huntflow.statement.GetStatement;
import com.huntflow.statement.LoadStatement;
import com.huntflow.statement.Statement;
import com.huntflow.store.InMemoryEntityStore;
import com.huntflow.syntax.StatementParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for SemanticResolver
 * Tests variable checks, source defaulting, relation validation and pattern compilation
 */
@ExtendWith(MockitoExtension.class)
class SemanticResolverTest {

    @Mock
    private DataSourceRegistry dataSources;

    private final StatementParser parser = new StatementParser();
    private final SessionConfig config = SessionConfig.defaults();
    private InMemoryEntityStore store;
    private SymbolTable symbolTable;
    private SemanticResolver resolver;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
        symbolTable = new SymbolTable(config.getDefaultVariable());
        resolver = new SemanticResolver(config, RelationCatalog.standard(), dataSources);
    }

    private void bind(String name, String entityType, Map<String, Object> row) {
        symbolTable.bind(name, new VariableBinding(store.insert(entityType, List.of(row)), store));
    }

    private Statement resolve(String text) {
        Statement statement = parser.parse(text, config).get(0);
        resolver.resolve(statement, symbolTable);
        return statement;
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    // ========== Variables ==========

    @Test
    void testResolve_undefinedReferenceFailsBeforeAnySourceLookup() {
        // Given: A GET whose pattern references an unknown variable
        String text = "y = GET process FROM file:///a.json WHERE pid = nosuch.pid";

        // When/Then: Resolution fails and the data sources are never touched
        assertThatThrownBy(() -> resolve(text))
                .isInstanceOf(UndefinedVariableException.class)
                .hasMessageContaining("nosuch");
        verifyNoInteractions(dataSources);
    }

    @Test
    void testResolve_undefinedInputVariable() {
        assertThatThrownBy(() -> resolve("DISP ghost"))
                .isInstanceOf(UndefinedVariableException.class)
                .satisfies(e -> assertThat(((UndefinedVariableException) e).getVariable()).isEqualTo("ghost"));
    }

    @Test
    void testResolve_emptyStringFieldIsAnInvariantViolation() {
        assertThatThrownBy(() -> resolve("x = GET process FROM \"\" WHERE pid = 1"))
                .isInstanceOf(InternalInvariantException.class)
                .hasMessageContaining("datasource");
    }

    // ========== GET sources ==========

    @Test
    void testResolve_getFromVariableCompilesStoreFilter() {
        bind("x", "process", row("id", "process--1", "pid", 4L));

        GetStatement get = (GetStatement) resolve("y = GET process FROM x WHERE pid = 4");

        assertThat(get.getVariableSource()).isEqualTo("x");
        assertThat(get.getDatasource()).isNull();
        assertThat(get.getWirePattern()).isNull();
        assertThat(get.getFilter().toSql()).isEqualTo("pid = 4");
        assertThat(get.getInputVariables()).containsExactly("x");
    }

    @Test
    void testResolve_getWithoutFromReusesLastQueriedSource() {
        when(dataSources.lastQueried()).thenReturn(Optional.of("file:///last.json"));

        GetStatement get = (GetStatement) resolve("y = GET process WHERE pid = 4");

        assertThat(get.getDatasource()).isEqualTo("file:///last.json");
        assertThat(get.getWirePattern()).isEqualTo("[process:pid = 4]");
    }

    @Test
    void testResolve_getWithoutFromAndNoHistoryFails() {
        when(dataSources.lastQueried()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolve("y = GET process WHERE pid = 4"))
                .isInstanceOf(SourceResolutionException.class);
    }

    @Test
    void testResolve_referenceWindowWidensByConfiguredOffsets() {
        // Given: A variable observed over one minute
        bind("procs", "process", row("id", "process--1", "pid", 4L,
                "first_observed", "2021-05-06T10:00:00Z", "last_observed", "2021-05-06T10:01:00Z"));

        // When: Referencing it from a GET on a URI
        GetStatement get = (GetStatement) resolve(
                "conns = GET network-traffic FROM file:///a.json WHERE x_pid = procs.pid");

        // Then: The wire pattern carries the widened window and the dereferenced value
        assertThat(get.getWirePattern()).isEqualTo("[network-traffic:x_pid = 4]"
                + " START t'2021-05-06T09:55:00.000Z' STOP t'2021-05-06T10:06:00.000Z'");
    }

    @Test
    void testResolve_explicitTimespanWinsOverReferenceWindow() {
        bind("procs", "process", row("id", "process--1", "pid", 4L, "first_observed", "2021-05-06T10:00:00Z"));

        GetStatement get = (GetStatement) resolve("conns = GET network-traffic FROM file:///a.json "
                + "WHERE x_pid = procs.pid START 2021-01-01T00:00:00Z STOP 2021-01-02T00:00:00Z");

        assertThat(get.getWirePattern()).endsWith(
                "START t'2021-01-01T00:00:00.000Z' STOP t'2021-01-02T00:00:00.000Z'");
    }

    // ========== FIND ==========

    @Test
    void testResolve_findAcceptsBothDirections() {
        bind("procs", "process", row("id", "process--1"));
        bind("conns", "network-traffic", row("id", "network-traffic--1"));

        FindStatement reversed = (FindStatement) resolve("c = FIND network-traffic created BY procs");
        FindStatement forward = (FindStatement) resolve("p = FIND process created conns WHERE dst_port = 443");

        assertThat(reversed.getFilter()).isNull();
        assertThat(forward.getWhere().getCenter()).isEqualTo("network-traffic");
        assertThat(forward.getFilter().toSql()).isEqualTo("dst_port = 443");
    }

    @Test
    void testResolve_findWhereIsCenteredOnInputType() {
        // Given: Connections and a FIND constraining them by address
        bind("conns", "network-traffic", row("id", "network-traffic--1"));

        // When: Resolving with a comparison on a type the connections reference
        FindStatement find = (FindStatement) resolve(
                "p = FIND process created conns WHERE ipv4-addr:value = '10.0.0.5'");

        // Then: The comparison is rewritten through the connections' reference paths
        assertThat(find.getWhere().getCenter()).isEqualTo("network-traffic");
        assertThat(find.getFilter().toSql())
                .contains("src_ref.value = '10.0.0.5'")
                .contains("dst_ref.value = '10.0.0.5'");
    }

    @Test
    void testResolve_findRejectsUnknownRelation() {
        bind("procs", "process", row("id", "process--1"));

        assertThatThrownBy(() -> resolve("c = FIND network-traffic created procs"))
                .isInstanceOf(UnsupportedRelationException.class)
                .satisfies(e -> {
                    UnsupportedRelationException unsupported = (UnsupportedRelationException) e;
                    assertThat(unsupported.getSubjectType()).isEqualTo("network-traffic");
                    assertThat(unsupported.getRelation()).isEqualTo("created");
                    assertThat(unsupported.getObjectType()).isEqualTo("process");
                });
    }

    @Test
    void testResolve_findAcceptsGenericRelationForAnyPair() {
        bind("urls", "url", row("id", "url--1"));

        FindStatement find = (FindStatement) resolve("m = FIND mutex linked urls");

        assertThat(find.getRelation()).isEqualTo("linked");
    }

    // ========== Projections and paths ==========

    @Test
    void testResolve_attributesLoseMatchingTypePrefix() {
        bind("x", "process", row("id", "process--1", "name", "a"));

        DispStatement disp = (DispStatement) resolve("DISP x WHERE pid > 1 ATTR process:name, pid");

        assertThat(disp.getAttributes().getAttributes()).containsExactly("name", "pid");
        assertThat(disp.getFilter().toSql()).isEqualTo("pid > 1");
    }

    @Test
    void testResolve_attributeOfOtherTypeIsRejected() {
        bind("x", "process", row("id", "process--1"));

        assertThatThrownBy(() -> resolve("DISP x ATTR file:name"))
                .isInstanceOf(InvalidAttributeException.class)
                .hasMessageContaining("file:name");
    }

    @Test
    void testResolve_loadPathIsExpandedAndNormalized() {
        LoadStatement load = (LoadStatement) resolve("x = LOAD ~/hunts/../data.json");

        String expected = Paths.get(System.getProperty("user.home"), "data.json").toAbsolutePath().normalize().toString();
        assertThat(load.getPath()).isEqualTo(expected);
    }

    // ========== APPLY ==========

    @Test
    void testResolve_applyArgumentsAreDereferenced() {
        symbolTable.bind("x", new VariableBinding(store.insert("process", List.of(
                row("id", "process--1", "name", "a.exe"), row("id", "process--2", "name", "b.exe"))), store));
        bind("y", "process", row("id", "process--3", "name", "c.exe"));

        ApplyStatement apply = (ApplyStatement) resolve(
                "APPLY python://enrich ON x WITH names = x.name, one = y.name, n = 3");

        assertThat(apply.getArguments())
                .containsEntry("names", List.of("a.exe", "b.exe"))
                .containsEntry("one", "c.exe")
                .containsEntry("n", 3L);
    }

    @Test
    void testResolve_applyWithUndefinedArgumentVariable() {
        bind("x", "process", row("id", "process--1"));

        assertThatThrownBy(() -> resolve("APPLY python://enrich ON x WITH names = z.name"))
                .isInstanceOf(UndefinedVariableException.class);
    }
}
