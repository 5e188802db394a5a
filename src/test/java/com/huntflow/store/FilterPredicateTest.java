package com.huntflow.store;

import com.huntflow.pattern.NullLiteral;
import com.huntflow.pattern.Operator;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for row-level filter evaluation and its SQL rendering.
 */
class FilterPredicateTest {

    private static final Map<String, Object> ROW = Map.of(
            "name", "svchost.exe",
            "pid", 612L,
            "src_port", "51234",
            "dst_ref.value", "10.1.2.3",
            "labels", List.of("system", "service"));

    @Test
    void testEquality_comparesNumbersAcrossTypes() {
        assertThat(new FilterPredicate("pid", Operator.EQUAL, 612).test(ROW)).isTrue();
        assertThat(new FilterPredicate("pid", Operator.EQUAL, 612.0).test(ROW)).isTrue();
        assertThat(new FilterPredicate("pid", Operator.NOT_EQUAL, 613L).test(ROW)).isTrue();
    }

    @Test
    void testOrdering_comparesNumericStringsAsNumbers() {
        // Given: A port stored as text
        // When/Then: Compared numerically against a number
        assertThat(new FilterPredicate("src_port", Operator.GREATER_THAN, 50000L).test(ROW)).isTrue();
        assertThat(new FilterPredicate("src_port", Operator.LESS_THAN_OR_EQUAL, 9L).test(ROW)).isFalse();
    }

    @Test
    void testLike_isAnchoredWithWildcards() {
        assertThat(new FilterPredicate("name", Operator.LIKE, "svc%.exe").test(ROW)).isTrue();
        assertThat(new FilterPredicate("name", Operator.LIKE, "svchost.ex_").test(ROW)).isTrue();
        assertThat(new FilterPredicate("name", Operator.LIKE, "host").test(ROW)).isFalse();
    }

    @Test
    void testMatches_searchesAnywhere() {
        assertThat(new FilterPredicate("name", Operator.MATCHES, "host\\.exe$").test(ROW)).isTrue();
    }

    @Test
    void testMatches_invalidRegexIsABackendError() {
        FilterPredicate predicate = new FilterPredicate("name", Operator.MATCHES, "([");

        assertThatThrownBy(() -> predicate.test(ROW))
                .isInstanceOf(StorePatternException.class)
                .satisfies(e -> assertThat(((StorePatternException) e).getPattern()).isEqualTo("name MATCHES '(['"));
    }

    @Test
    void testIn_matchesAnyListCell() {
        assertThat(new FilterPredicate("labels", Operator.IN, List.of("service", "user")).test(ROW)).isTrue();
        assertThat(new FilterPredicate("labels", Operator.NOT_IN, List.of("user")).test(ROW)).isTrue();
        assertThat(new FilterPredicate("pid", Operator.IN, List.of(1L, 2L)).test(ROW)).isFalse();
    }

    @Test
    void testIsSubset_checksCidrMembership() {
        assertThat(new FilterPredicate("dst_ref.value", Operator.ISSUBSET, "10.0.0.0/8").test(ROW)).isTrue();
        assertThat(new FilterPredicate("dst_ref.value", Operator.NOT_ISSUBSET, "192.168.0.0/16").test(ROW)).isTrue();
        assertThat(new FilterPredicate("dst_ref.value", Operator.ISSUBSET, "10.1.2.3").test(ROW)).isTrue();
    }

    @Test
    void testIsSubset_onlyMatchesLiteralAddresses() {
        // Given: Cells holding shorthand, integer and word values next to real addresses
        Map<String, Object> row = Map.of(
                "short", "10.1",
                "integer", "167772161",
                "word", "cafe",
                "full", "10.0.0.5",
                "v6", "2001:db8::7");

        // When/Then: Only dotted quads and IPv6 literals fall inside a block
        assertThat(new FilterPredicate("short", Operator.ISSUBSET, "10.0.0.0/8").test(row)).isFalse();
        assertThat(new FilterPredicate("integer", Operator.ISSUBSET, "10.0.0.0/8").test(row)).isFalse();
        assertThat(new FilterPredicate("word", Operator.ISSUBSET, "10.0.0.0/8").test(row)).isFalse();
        assertThat(new FilterPredicate("full", Operator.ISSUBSET, "10.0.0.0/8").test(row)).isTrue();
        assertThat(new FilterPredicate("v6", Operator.ISSUBSET, "2001:db8::/32").test(row)).isTrue();
        assertThat(new FilterPredicate("v6", Operator.ISSUBSET, "10.0.0.0/8").test(row)).isFalse();
    }

    @Test
    void testIsSubset_nonLiteralNetworkIsABackendError() {
        FilterPredicate predicate = new FilterPredicate("dst_ref.value", Operator.ISSUBSET, "cafe/8");

        assertThatThrownBy(() -> predicate.test(ROW))
                .isInstanceOf(StorePatternException.class)
                .hasMessageContaining("invalid network address cafe/8");
    }

    @Test
    void testNull_matchesMissingAndEmptyCells() {
        Map<String, Object> row = new HashMap<>();
        row.put("refs", List.of());

        assertThat(new FilterPredicate("command_line", Operator.EQUAL, NullLiteral.INSTANCE).test(row)).isTrue();
        assertThat(new FilterPredicate("refs", Operator.EQUAL, NullLiteral.INSTANCE).test(row)).isTrue();
        assertThat(new FilterPredicate("name", Operator.NOT_EQUAL, NullLiteral.INSTANCE).test(ROW)).isTrue();
    }

    @Test
    void testMissingAttribute_neverMatchesComparisons() {
        assertThat(new FilterPredicate("ppid", Operator.NOT_EQUAL, 1L).test(ROW)).isFalse();
    }

    @Test
    void testToSql_quotesColumnsAndValues() {
        assertThat(new FilterPredicate("name", Operator.EQUAL, "o'neil").toSql()).isEqualTo("name = 'o''neil'");
        assertThat(new FilterPredicate("dst_ref.value", Operator.IN, List.of("a", "b")).toSql())
                .isEqualTo("\"dst_ref.value\" IN ('a', 'b')");
        assertThat(new FilterPredicate("pid", Operator.NOT_EQUAL, NullLiteral.INSTANCE).toSql())
                .isEqualTo("pid IS NOT NULL");
    }

    @Test
    void testJunction_combinesLeaves() {
        StoreFilter filter = new FilterJunction("OR",
                new FilterPredicate("pid", Operator.EQUAL, 1L),
                new FilterPredicate("name", Operator.EQUAL, "svchost.exe"));

        assertThat(filter.test(ROW)).isTrue();
        assertThat(filter.toSql()).isEqualTo("(pid = 1 OR name = 'svchost.exe')");
    }
}
