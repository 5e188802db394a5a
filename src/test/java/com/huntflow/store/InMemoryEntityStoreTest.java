package com.huntflow.store;

import com.huntflow.pattern.Operator;
import com.huntflow.statement.Aggregation;
import com.huntflow.statement.AggregationFunction;
import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.BinnedAttribute;
import com.huntflow.statement.GroupAttribute;
import com.huntflow.statement.Paging;
import com.huntflow.statement.SortSpec;
import com.huntflow.statement.TimeRange;
import com.huntflow.statement.Transform;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryEntityStore Tests")
class InMemoryEntityStoreTest {

    private InMemoryEntityStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryEntityStore();
    }

    private static Map<String, Object> row(Object... keyValues) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            row.put((String) keyValues[i], keyValues[i + 1]);
        }
        return row;
    }

    private ResultSetHandle processes() {
        return store.insert("process", List.of(
                row("id", "process--1", "name", "cmd.exe", "pid", 4L,
                        "first_observed", "2021-05-06T10:00:00Z", "last_observed", "2021-05-06T10:05:00Z"),
                row("id", "process--2", "name", "powershell.exe", "pid", 8L,
                        "first_observed", "2021-05-06T09:00:00Z"),
                row("id", "process--3", "name", "cmd.exe", "pid", 12L)));
    }

    @Test
    @DisplayName("Should generate ids and flatten nested objects on insert")
    void shouldGenerateIdsAndFlattenOnInsert() {
        Map<String, Object> nested = row("name", "a.exe", "binary", row("name", "a.exe", "size", 10L));

        ResultSetHandle handle = store.insert("process", List.of(nested));

        Map<String, Object> stored = store.rows(handle, AttributeSelector.all()).get(0);
        assertThat(String.valueOf(stored.get("id"))).startsWith("process--");
        assertThat(stored).containsEntry("binary.size", 10L).doesNotContainKey("binary");
        assertThat(handle.getEntityType()).isEqualTo("process");
    }

    @Test
    @DisplayName("Should filter, sort and page into a new result set")
    void shouldFilterSortAndPage() {
        ResultSetHandle all = processes();

        ResultSetHandle filtered = store.filter(all, new FilterPredicate("name", Operator.EQUAL, "cmd.exe"),
                new SortSpec("pid", false), Paging.of(1, null));

        assertThat(filtered).isNotEqualTo(all);
        assertThat(store.values(filtered, "pid")).containsExactly(12L);
        assertThat(store.count(all)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep rows without the sort attribute last in both directions")
    void shouldSortNullsLast() {
        ResultSetHandle handle = store.insert("file", List.of(
                row("id", "file--1", "size", 5L),
                row("id", "file--2"),
                row("id", "file--3", "size", 7L)));

        ResultSetHandle ascending = store.filter(handle, null, new SortSpec("size", true), Paging.none());
        ResultSetHandle descending = store.filter(handle, null, new SortSpec("size", false), Paging.none());

        assertThat(store.values(ascending, "id")).containsExactly("file--1", "file--3", "file--2");
        assertThat(store.values(descending, "id")).containsExactly("file--3", "file--1", "file--2");
    }

    @Test
    @DisplayName("Should apply offset before limit")
    void shouldApplyOffsetThenLimit() {
        ResultSetHandle handle = processes();

        ResultSetHandle page = store.filter(handle, null, new SortSpec("pid", true), Paging.of(1, 1));

        assertThat(store.values(page, "pid")).containsExactly(8L);
    }

    @Test
    @DisplayName("Should always keep id when projecting")
    void shouldKeepIdWhenProjecting() {
        ResultSetHandle projected = store.project(processes(), AttributeSelector.of(List.of("name")));

        assertThat(store.rows(projected, AttributeSelector.all()))
                .allSatisfy(r -> assertThat(r.keySet()).containsExactly("id", "name"));
    }

    @Test
    @DisplayName("Should follow reference attributes when filtering")
    void shouldFollowReferencesWhenFiltering() {
        store.insert("ipv4-addr", List.of(row("id", "ipv4-addr--1", "value", "10.0.0.1"),
                row("id", "ipv4-addr--2", "value", "192.168.1.1")));
        ResultSetHandle traffic = store.insert("network-traffic", List.of(
                row("id", "network-traffic--1", "src_ref", "ipv4-addr--1", "dst_port", 443L),
                row("id", "network-traffic--2", "src_ref", "ipv4-addr--2", "dst_port", 80L)));

        ResultSetHandle internal = store.filter(traffic,
                new FilterPredicate("src_ref.value", Operator.ISSUBSET, "10.0.0.0/8"), null, Paging.none());

        assertThat(store.values(internal, "id")).containsExactly("network-traffic--1");
        assertThat(store.values(internal, "src_ref.value")).containsExactly("10.0.0.1");
    }

    @Test
    @DisplayName("Should find entities linked in either direction")
    void shouldFindRelatedEntities() {
        // Given: A parent process pointing at children and a connection pointing nowhere
        ResultSetHandle parent = store.insert("process", List.of(
                row("id", "process--p", "name", "explorer.exe", "child_refs", List.of("process--c1"),
                        "opened_connection_refs", List.of("network-traffic--1"))));
        store.insert("process", List.of(
                row("id", "process--c1", "name", "cmd.exe"),
                row("id", "process--c2", "name", "calc.exe", "parent_ref", "process--p"),
                row("id", "process--c3", "name", "other.exe")));
        store.insert("network-traffic", List.of(row("id", "network-traffic--1", "dst_port", 443L)));

        // When: Following child_refs forward and parent_ref backward
        ResultSetHandle children = store.related(parent, "process", List.of("child_refs"), List.of("parent_ref"));
        ResultSetHandle connections = store.related(parent, "network-traffic",
                List.of("opened_connection_refs"), List.of());

        // Then: Both kinds of link are found
        assertThat(store.values(children, "name")).containsExactlyInAnyOrder("cmd.exe", "calc.exe");
        assertThat(store.values(connections, "dst_port")).containsExactly(443L);
    }

    @Test
    @DisplayName("Should join with left values over right values")
    void shouldJoinPreferringLeftValues() {
        ResultSetHandle left = store.insert("process", List.of(row("id", "process--1", "pid", 4L, "name", "left")));
        ResultSetHandle right = store.insert("process", List.of(
                row("id", "process--9", "pid", 4L, "name", "right", "command_line", "cmd /c dir")));

        ResultSetHandle joined = store.join(left, right, "pid", "pid");

        List<Map<String, Object>> rows = store.rows(joined, AttributeSelector.all());
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0))
                .containsEntry("name", "left")
                .containsEntry("id", "process--1")
                .containsEntry("command_line", "cmd /c dir");
    }

    @Test
    @DisplayName("Should count per group when no aggregation is given")
    void shouldCountGroupsByDefault() {
        ResultSetHandle grouped = store.group(processes(), List.of(new GroupAttribute("name")), List.of());

        List<Map<String, Object>> rows = store.rows(grouped, AttributeSelector.all());
        assertThat(rows).containsExactly(
                Map.of("name", "cmd.exe", InMemoryEntityStore.NUMBER_OBSERVED, 2L),
                Map.of("name", "powershell.exe", InMemoryEntityStore.NUMBER_OBSERVED, 1L));
    }

    @Test
    @DisplayName("Should aggregate and bin timestamps")
    void shouldAggregateAndBin() {
        ResultSetHandle grouped = store.group(processes(),
                List.of(new BinnedAttribute("first_observed", 1, ChronoUnit.HOURS, "hour")),
                List.of(new Aggregation(AggregationFunction.MAX, "pid", null),
                        new Aggregation(AggregationFunction.COUNT, "pid", "n")));

        List<Map<String, Object>> rows = store.rows(grouped, AttributeSelector.all());
        Map<Object, Map<String, Object>> byHour = new HashMap<>();
        rows.forEach(r -> byHour.put(r.get("hour"), r));
        assertThat(byHour.get(Instant.parse("2021-05-06T10:00:00Z"))).containsEntry("max_pid", 4L).containsEntry("n", 1L);
        assertThat(byHour.get(Instant.parse("2021-05-06T09:00:00Z"))).containsEntry("max_pid", 8L);
        assertThat(byHour).containsKey(null);
    }

    @Test
    @DisplayName("Should merge by id and reject mixed types")
    void shouldMergeById() {
        ResultSetHandle a = store.insert("process", List.of(row("id", "process--1"), row("id", "process--2")));
        ResultSetHandle b = store.insert("process", List.of(row("id", "process--2"), row("id", "process--3")));
        ResultSetHandle file = store.insert("file", List.of(row("id", "file--1")));

        ResultSetHandle merged = store.merge(List.of(a, b));

        assertThat(store.values(merged, "id")).containsExactly("process--1", "process--2", "process--3");
        assertThatThrownBy(() -> store.merge(List.of(a, file))).isInstanceOf(EntityTypeMismatchException.class);
    }

    @Test
    @DisplayName("Should flatten list cells when collecting values")
    void shouldFlattenListValues() {
        ResultSetHandle handle = store.insert("domain-name", List.of(
                row("id", "d--1", "resolves_to_refs", List.of("ip--1", "ip--2")),
                row("id", "d--2", "resolves_to_refs", Arrays.asList("ip--2", null))));

        assertThat(store.values(handle, "resolves_to_refs")).containsExactly("ip--1", "ip--2");
    }

    @Test
    @DisplayName("Should compute time bounds from observation timestamps")
    void shouldComputeTimeBounds() {
        assertThat(store.timeBounds(processes())).contains(new TimeRange(
                Instant.parse("2021-05-06T09:00:00Z"), Instant.parse("2021-05-06T10:05:00Z")));
        assertThat(store.timeBounds(store.insert("file", List.of(row("id", "file--1"))))).isEmpty();
    }

    @Test
    @DisplayName("Should order TIMESTAMPED rows and drop untimed ones")
    void shouldApplyTimestampedTransform() {
        ResultSetHandle timestamped = store.transform(processes(), Transform.TIMESTAMPED);

        assertThat(store.values(timestamped, "pid")).containsExactly(8L, 4L);
    }

    @Test
    @DisplayName("Should list attributes of every stored entity of a type")
    void shouldListAttributes() {
        processes();
        store.insert("process", List.of(row("id", "process--9", "command_line", "x")));

        assertThat(store.attributes("process"))
                .containsExactly("command_line", "first_observed", "id", "last_observed", "name", "pid");
        assertThat(store.attributes("mutex")).isEmpty();
    }

    @Test
    @DisplayName("Should reject use after close and close idempotently")
    void shouldRejectUseAfterClose() {
        ResultSetHandle handle = processes();

        store.close();
        store.close();

        assertThat(store.isClosed()).isTrue();
        assertThatThrownBy(() -> store.count(handle))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("closed");
    }
}
