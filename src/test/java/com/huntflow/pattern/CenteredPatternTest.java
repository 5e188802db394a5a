package com.huntflow.pattern;

import com.huntflow.InternalInvariantException;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.relations.UnsupportedRelationException;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.StoreFilter;
import com.huntflow.syntax.StatementParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CenteredPattern: center binding, reference resolution and the two
 * compilation targets.
 */
class CenteredPatternTest {

    private StatementParser parser;
    private RelationCatalog catalog;

    @BeforeEach
    void setUp() {
        parser = new StatementParser();
        catalog = RelationCatalog.standard();
    }

    private CenteredPattern pattern(String text) {
        return parser.parsePattern(text).getPattern();
    }

    @Test
    void testToWirePattern_reproducesCanonicalPattern() {
        // Given: A canonical wire pattern
        CenteredPattern pattern = pattern("[url:value LIKE '%']");

        // When: Binding the center and serializing
        String wire = pattern.bindCenter("url").toWirePattern(null);

        // Then: The text is unchanged
        assertThat(wire).isEqualTo("[url:value LIKE '%']");
    }

    @Test
    void testToWirePattern_listWithoutSpaces() {
        CenteredPattern pattern = new CenteredPattern(new Comparison(null, "pid", Operator.IN, List.of(1L, 2L, 3L)));

        assertThat(pattern.bindCenter("process").toWirePattern(null)).isEqualTo("[process:pid IN (1,2,3)]");
    }

    @Test
    void testToWirePattern_reparsesToEqualTree() {
        CenteredPattern original = pattern("[process:name = 'cmd.exe' AND (process:pid > 4 OR process:pid IN (1,2))]")
                .bindCenter("process");

        String wire = original.toWirePattern(null);
        CenteredPattern reparsed = pattern(wire).bindCenter("process");

        assertThat(reparsed.getRoot()).isEqualTo(original.getRoot());
        assertThat(reparsed.toWirePattern(null)).isEqualTo(wire);
    }

    @Test
    void testToWirePattern_escapesQuotesAndAppendsRange() {
        CenteredPattern pattern = new CenteredPattern(new Comparison(null, "command_line", Operator.EQUAL, "it's"))
                .bindCenter("process");
        TimeRange range = new TimeRange(Instant.parse("2021-05-06T00:00:00Z"), Instant.parse("2021-05-06T00:10:00Z"));

        String wire = pattern.toWirePattern(range);

        assertThat(wire).isEqualTo("[process:command_line = 'it\\'s']"
                + " START t'2021-05-06T00:00:00.000Z' STOP t'2021-05-06T00:10:00.000Z'");
        assertThat(parser.parsePattern(wire).getTimeRange()).isEqualTo(range);
    }

    @Test
    void testToWirePattern_foreignTypeFollowsReferencePaths() {
        // Given: A comparison on ipv4-addr inside a network-traffic pattern
        CenteredPattern pattern = new CenteredPattern(
                new Comparison("ipv4-addr", "value", Operator.EQUAL, "10.0.0.1")).bindCenter("network-traffic");

        // When: Serializing
        String wire = pattern.toWirePattern(null, catalog);

        // Then: One comparison per reference path, OR-ed
        assertThat(wire).isEqualTo("[(network-traffic:src_ref.value = '10.0.0.1'"
                + " OR network-traffic:dst_ref.value = '10.0.0.1')]");
    }

    @Test
    void testToWirePattern_foreignTypeWithoutPathIsRejected() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison("mutex", "name", Operator.EQUAL, "m")).bindCenter("url");

        assertThatThrownBy(() -> pattern.toWirePattern(null, catalog))
                .isInstanceOf(UnsupportedRelationException.class);
    }

    @Test
    void testBindCenter_twiceIsAnInvariantViolation() {
        CenteredPattern bound = pattern("[pid = 1]").bindCenter("process");

        assertThatThrownBy(() -> bound.bindCenter("file"))
                .isInstanceOf(InternalInvariantException.class)
                .hasMessageContaining("already bound");
    }

    @Test
    void testCompile_beforeBindingIsAnInvariantViolation() {
        CenteredPattern unbound = pattern("[pid = 1]");

        assertThatThrownBy(() -> unbound.toWirePattern(null)).isInstanceOf(InternalInvariantException.class);
        assertThatThrownBy(unbound::toBackendFilter).isInstanceOf(InternalInvariantException.class);
    }

    @Test
    void testBindCenter_keepsExplicitTypes() {
        CenteredPattern pattern = new CenteredPattern(new Junction(Junction.Kind.AND,
                new Comparison(null, "pid", Operator.EQUAL, 1L),
                new Comparison("process", "name", Operator.EQUAL, "a")));

        Junction bound = (Junction) pattern.bindCenter("process").getRoot();

        assertThat(((Comparison) bound.getLeft()).getEntityType()).isEqualTo("process");
        assertThat(((Comparison) bound.getRight()).getEntityType()).isEqualTo("process");
    }

    // ========== Reference resolution ==========

    @Test
    void testResolveReferences_singleValueStaysScalar() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison(null, "pid", Operator.EQUAL, new Reference("procs", "pid"))).bindCenter("process");

        CenteredPattern resolved = pattern.resolveReferences(new MapResolver(Map.of("procs.pid", List.of(4L))));

        assertThat(resolved.getRoot()).isEqualTo(new Comparison("process", "pid", Operator.EQUAL, 4L));
        assertThat(resolved.toWirePattern(null)).isEqualTo("[process:pid = 4]");
    }

    @Test
    void testResolveReferences_severalValuesWidenEquality() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison(null, "pid", Operator.NOT_EQUAL, new Reference("procs", "pid"))).bindCenter("process");

        CenteredPattern resolved = pattern.resolveReferences(new MapResolver(Map.of("procs.pid", List.of(4L, 8L))));

        assertThat(resolved.getRoot()).isEqualTo(new Comparison("process", "pid", Operator.NOT_IN, List.of(4L, 8L)));
    }

    @Test
    void testResolveReferences_listOperatorKeepsList() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison(null, "pid", Operator.IN, new Reference("procs", "pid"))).bindCenter("process");

        CenteredPattern resolved = pattern.resolveReferences(new MapResolver(Map.of("procs.pid", List.of(4L))));

        assertThat(resolved.toWirePattern(null)).isEqualTo("[process:pid IN (4)]");
    }

    @Test
    void testResolveReferences_emptyReferenceIsRejected() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison(null, "pid", Operator.EQUAL, new Reference("procs", "pid"))).bindCenter("process");

        assertThatThrownBy(() -> pattern.resolveReferences(new MapResolver(Map.of("procs.pid", List.of()))))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("procs.pid");
    }

    @Test
    void testResolveReferences_windowIsUnionOfVariableBounds() {
        // Given: Two referenced variables with different observation windows
        CenteredPattern pattern = new CenteredPattern(new Junction(Junction.Kind.OR,
                new Comparison(null, "pid", Operator.EQUAL, new Reference("a", "pid")),
                new Comparison(null, "name", Operator.EQUAL, new Reference("b", "name")))).bindCenter("process");
        MapResolver resolver = new MapResolver(Map.of("a.pid", List.of(1L), "b.name", List.of("x")));
        resolver.bounds.put("a", new TimeRange(Instant.parse("2021-01-01T00:00:00Z"), Instant.parse("2021-01-02T00:00:00Z")));
        resolver.bounds.put("b", new TimeRange(Instant.parse("2020-12-31T00:00:00Z"), Instant.parse("2021-01-01T12:00:00Z")));

        // When: Resolving
        CenteredPattern resolved = pattern.resolveReferences(resolver);

        // Then: The window spans both
        assertThat(resolved.getWindow()).isEqualTo(new TimeRange(
                Instant.parse("2020-12-31T00:00:00Z"), Instant.parse("2021-01-02T00:00:00Z")));
        assertThat(pattern.getReferencedVariables()).containsExactly("a", "b");
    }

    // ========== Backend filter ==========

    @Test
    void testToBackendFilter_matchesRows() {
        StoreFilter filter = pattern("[name LIKE 'cmd%' AND pid >= 4]").bindCenter("process").toBackendFilter();

        assertThat(filter.test(Map.of("name", "cmd.exe", "pid", 4L))).isTrue();
        assertThat(filter.test(Map.of("name", "cmd.exe", "pid", 3L))).isFalse();
        assertThat(filter.test(Map.of("name", "bash", "pid", 10L))).isFalse();
        assertThat(filter.toSql()).isEqualTo("(name LIKE 'cmd%' AND pid >= 4)");
    }

    @Test
    void testToBackendFilter_unresolvedReferenceIsRejected() {
        CenteredPattern pattern = new CenteredPattern(
                new Comparison(null, "pid", Operator.EQUAL, new Reference("procs", "pid"))).bindCenter("process");

        assertThatThrownBy(pattern::toBackendFilter).isInstanceOf(InvalidPatternException.class);
    }

    private static class MapResolver implements ReferenceResolver {
        private final Map<String, List<Object>> values = new HashMap<>();
        private final Map<String, TimeRange> bounds = new HashMap<>();

        MapResolver(Map<String, ? extends List<?>> values) {
            values.forEach((key, list) -> this.values.put(key, List.copyOf(list)));
        }

        @Override
        public List<Object> values(Reference reference) {
            return values.getOrDefault(reference.toString(), List.of());
        }

        @Override
        public Optional<TimeRange> timeBounds(String variable) {
            return Optional.ofNullable(bounds.get(variable));
        }
    }
}
