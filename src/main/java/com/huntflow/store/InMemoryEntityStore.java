package com.huntflow.store;

import com.huntflow.InternalInvariantException;
import com.huntflow.statement.Aggregation;
import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.BinnedAttribute;
import com.huntflow.statement.GroupingSpec;
import com.huntflow.statement.Paging;
import com.huntflow.statement.SortSpec;
import com.huntflow.statement.TimeRange;
import com.huntflow.statement.Transform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Reference {@link EntityStore} keeping every row in memory.
 *
 * <p>Entities are indexed by type and by id across all inserts, so relations and
 * reference paths resolve against everything the session has seen. Result sets are
 * immutable row lists addressed by handle.
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    public static final String NUMBER_OBSERVED = "number_observed";

    private final Map<String, Map<Object, Map<String, Object>>> entitiesByType = new LinkedHashMap<>();
    private final Map<Object, Map<String, Object>> entitiesById = new HashMap<>();
    private final Map<String, ResultSet> resultSets = new HashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private boolean closed;

    @Override
    public ResultSetHandle insert(String entityType, List<Map<String, Object>> rows) {
        ensureOpen();
        Map<Object, Map<String, Object>> table = entitiesByType.computeIfAbsent(entityType, t -> new LinkedHashMap<>());
        List<Map<String, Object>> stored = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> entity = Collections.unmodifiableMap(EntityRows.withId(entityType, EntityRows.flatten(row)));
            Object id = entity.get(EntityRows.ID);
            table.put(id, entity);
            entitiesById.put(id, entity);
            stored.add(entity);
        }
        log.debug("Inserted {} {} row(s)", stored.size(), entityType);
        return register(entityType, stored);
    }

    @Override
    public ResultSetHandle filter(ResultSetHandle source, StoreFilter filter, SortSpec sort, Paging paging) {
        ResultSet input = resultSet(source);
        List<Map<String, Object>> rows = input.rows;
        if (filter != null) {
            log.debug("Filtering {} with {}", source, filter.toSql());
            rows = rows.stream().filter(row -> filter.test(view(row))).collect(Collectors.toList());
        }
        if (sort != null) {
            Comparator<Map<String, Object>> order = Comparator.comparing(
                    row -> view(row).get(sort.getAttribute()), RowValues.ORDER);
            if (!sort.isAscending()) {
                // keep nulls last in both directions
                order = Comparator.comparing(row -> view(row).get(sort.getAttribute()),
                        Comparator.nullsLast(RowValues.ORDER.reversed()));
            }
            rows = rows.stream().sorted(order).collect(Collectors.toList());
        }
        return register(input.entityType, page(rows, paging));
    }

    private static List<Map<String, Object>> page(List<Map<String, Object>> rows, Paging paging) {
        if (paging == null || paging.isEmpty()) {
            return rows;
        }
        int from = paging.getOffset() != null ? Math.min(paging.getOffset(), rows.size()) : 0;
        int to = paging.getLimit() != null ? Math.min(from + paging.getLimit(), rows.size()) : rows.size();
        return new ArrayList<>(rows.subList(from, to));
    }

    @Override
    public ResultSetHandle project(ResultSetHandle source, AttributeSelector attributes) {
        ResultSet input = resultSet(source);
        if (attributes == null || attributes.isAll()) {
            return register(input.entityType, input.rows);
        }
        List<Map<String, Object>> rows = new ArrayList<>(input.rows.size());
        for (Map<String, Object> row : input.rows) {
            Map<String, Object> linked = view(row);
            Map<String, Object> projected = new LinkedHashMap<>();
            projected.put(EntityRows.ID, row.get(EntityRows.ID));
            for (String attribute : attributes.getAttributes()) {
                projected.put(attribute, linked.get(attribute));
            }
            rows.add(Collections.unmodifiableMap(projected));
        }
        return register(input.entityType, rows);
    }

    @Override
    public ResultSetHandle transform(ResultSetHandle source, Transform transform) {
        ResultSet input = resultSet(source);
        List<Map<String, Object>> rows;
        switch (transform) {
            case TIMESTAMPED:
                rows = input.rows.stream()
                        .filter(row -> RowValues.toInstant(row.get(EntityRows.FIRST_OBSERVED)) != null)
                        .sorted(Comparator.comparing(row -> RowValues.toInstant(row.get(EntityRows.FIRST_OBSERVED))))
                        .collect(Collectors.toList());
                break;
            case ADDOBSID:
                rows = new ArrayList<>();
                for (Map<String, Object> row : input.rows) {
                    Map<String, Object> copy = new LinkedHashMap<>(row);
                    copy.computeIfAbsent(EntityRows.OBSERVATION_ID, k -> "observed-data--"
                            + UUID.nameUUIDFromBytes(String.valueOf(row.get(EntityRows.ID)).getBytes(StandardCharsets.UTF_8)));
                    rows.add(Collections.unmodifiableMap(copy));
                }
                break;
            case RECORDS:
                rows = new ArrayList<>(input.rows);
                break;
            default:
                throw new InternalInvariantException("unhandled transform " + transform);
        }
        return register(input.entityType, rows);
    }

    @Override
    public ResultSetHandle related(ResultSetHandle source, String returnType, List<String> sourceRefs,
                                   List<String> returnRefs) {
        ResultSet input = resultSet(source);
        Set<Object> sourceIds = new HashSet<>();
        Set<Object> targetIds = new HashSet<>();
        for (Map<String, Object> row : input.rows) {
            sourceIds.add(row.get(EntityRows.ID));
            for (String ref : sourceRefs) {
                targetIds.addAll(EntityRows.referencedIds(row.get(ref)));
            }
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> candidate : entitiesByType.getOrDefault(returnType, Map.of()).values()) {
            boolean linked = targetIds.contains(candidate.get(EntityRows.ID));
            for (int i = 0; !linked && i < returnRefs.size(); i++) {
                linked = EntityRows.referencedIds(candidate.get(returnRefs.get(i))).stream().anyMatch(sourceIds::contains);
            }
            if (linked) {
                rows.add(candidate);
            }
        }
        log.debug("Found {} {} row(s) related to {}", rows.size(), returnType, source);
        return register(returnType, rows);
    }

    @Override
    public ResultSetHandle join(ResultSetHandle left, ResultSetHandle right, String leftAttribute,
                                String rightAttribute) {
        ResultSet l = resultSet(left);
        ResultSet r = resultSet(right);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map<String, Object> leftRow : l.rows) {
            Object key = view(leftRow).get(leftAttribute);
            if (key == null) {
                continue;
            }
            for (Map<String, Object> rightRow : r.rows) {
                if (RowValues.scalarEquals(key, view(rightRow).get(rightAttribute))) {
                    Map<String, Object> joined = new LinkedHashMap<>(rightRow);
                    joined.putAll(leftRow);
                    rows.add(Collections.unmodifiableMap(joined));
                }
            }
        }
        return register(l.entityType, rows);
    }

    @Override
    public ResultSetHandle group(ResultSetHandle source, List<GroupingSpec> groupings,
                                 List<Aggregation> aggregations) {
        ResultSet input = resultSet(source);
        Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
        for (Map<String, Object> row : input.rows) {
            Map<String, Object> linked = view(row);
            List<Object> key = new ArrayList<>(groupings.size());
            for (GroupingSpec grouping : groupings) {
                key.add(groupValue(grouping, linked.get(grouping.getAttribute())));
            }
            groups.computeIfAbsent(key, k -> new ArrayList<>()).add(row);
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Map.Entry<List<Object>, List<Map<String, Object>>> group : groups.entrySet()) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < groupings.size(); i++) {
                out.put(groupings.get(i).getAlias(), group.getKey().get(i));
            }
            if (aggregations.isEmpty()) {
                out.put(NUMBER_OBSERVED, (long) group.getValue().size());
            }
            for (Aggregation aggregation : aggregations) {
                List<Object> cells = group.getValue().stream()
                        .map(row -> view(row).get(aggregation.getAttribute()))
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList());
                out.put(aggregation.getAlias(), aggregate(aggregation, cells));
            }
            rows.add(Collections.unmodifiableMap(out));
        }
        return register(input.entityType, rows);
    }

    private static Object groupValue(GroupingSpec grouping, Object value) {
        if (!(grouping instanceof BinnedAttribute) || value == null) {
            return value;
        }
        BinnedAttribute bin = (BinnedAttribute) grouping;
        Instant time = RowValues.toInstant(value);
        if (bin.getUnit() != null || (time != null && !(value instanceof Number))) {
            if (time == null) {
                return null;
            }
            long seconds = bin.getUnit() != null ? bin.getUnit().getDuration().getSeconds() : 1L;
            long size = bin.getWidth() * seconds;
            return Instant.ofEpochSecond(Math.floorDiv(time.getEpochSecond(), size) * size);
        }
        Double number = RowValues.toDouble(value);
        if (number == null) {
            return null;
        }
        long bucket = (long) Math.floor(number / bin.getWidth()) * bin.getWidth();
        return bucket;
    }

    private static Object aggregate(Aggregation aggregation, List<Object> cells) {
        switch (aggregation.getFunction()) {
            case COUNT:
                return (long) cells.size();
            case NUNIQUE:
                return (long) new LinkedHashSet<>(cells.stream().map(String::valueOf).collect(Collectors.toList())).size();
            case MAX:
                return cells.stream().max(RowValues.ORDER).orElse(null);
            case MIN:
                return cells.stream().min(RowValues.ORDER).orElse(null);
            case SUM:
                return cells.stream().map(RowValues::toDouble).filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue).sum();
            case AVG:
                return cells.stream().map(RowValues::toDouble).filter(Objects::nonNull)
                        .mapToDouble(Double::doubleValue).average().orElse(Double.NaN);
            default:
                throw new InternalInvariantException("unhandled aggregation " + aggregation.getFunction());
        }
    }

    @Override
    public ResultSetHandle merge(List<ResultSetHandle> sources) {
        if (sources.isEmpty()) {
            throw new InternalInvariantException("nothing to merge");
        }
        String entityType = sources.get(0).getEntityType();
        Map<Object, Map<String, Object>> merged = new LinkedHashMap<>();
        for (ResultSetHandle handle : sources) {
            ResultSet input = resultSet(handle);
            if (!input.entityType.equals(entityType)) {
                throw new EntityTypeMismatchException(entityType, input.entityType);
            }
            for (Map<String, Object> row : input.rows) {
                merged.putIfAbsent(row.getOrDefault(EntityRows.ID, row), row);
            }
        }
        return register(entityType, new ArrayList<>(merged.values()));
    }

    @Override
    public List<Map<String, Object>> rows(ResultSetHandle handle, AttributeSelector attributes) {
        ResultSet input = resultSet(handle);
        List<Map<String, Object>> rows = new ArrayList<>(input.rows.size());
        for (Map<String, Object> row : input.rows) {
            if (attributes == null || attributes.isAll()) {
                rows.add(new LinkedHashMap<>(row));
            } else {
                Map<String, Object> linked = view(row);
                Map<String, Object> projected = new LinkedHashMap<>();
                for (String attribute : attributes.getAttributes()) {
                    projected.put(attribute, linked.get(attribute));
                }
                rows.add(projected);
            }
        }
        return rows;
    }

    @Override
    public List<Object> values(ResultSetHandle handle, String attribute) {
        Set<Object> values = new LinkedHashSet<>();
        for (Map<String, Object> row : resultSet(handle).rows) {
            Object cell = view(row).get(attribute);
            if (cell instanceof Collection) {
                ((Collection<?>) cell).stream().filter(Objects::nonNull).forEach(values::add);
            } else if (cell != null) {
                values.add(cell);
            }
        }
        return new ArrayList<>(values);
    }

    @Override
    public long count(ResultSetHandle handle) {
        return resultSet(handle).rows.size();
    }

    @Override
    public Optional<TimeRange> timeBounds(ResultSetHandle handle) {
        Instant earliest = null;
        Instant latest = null;
        for (Map<String, Object> row : resultSet(handle).rows) {
            Instant first = RowValues.toInstant(row.get(EntityRows.FIRST_OBSERVED));
            Instant last = RowValues.toInstant(row.get(EntityRows.LAST_OBSERVED));
            if (last == null) {
                last = first;
            }
            if (first != null && (earliest == null || first.isBefore(earliest))) {
                earliest = first;
            }
            if (last != null && (latest == null || last.isAfter(latest))) {
                latest = last;
            }
        }
        if (earliest == null || latest == null) {
            return Optional.empty();
        }
        return Optional.of(new TimeRange(earliest, latest));
    }

    @Override
    public List<String> attributes(String entityType) {
        Set<String> names = new TreeSet<>();
        entitiesByType.getOrDefault(entityType, Map.of()).values().forEach(row -> names.addAll(row.keySet()));
        return new ArrayList<>(names);
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            resultSets.clear();
            entitiesByType.clear();
            entitiesById.clear();
            log.debug("In-memory store closed");
        }
    }

    public boolean isClosed() {
        return closed;
    }

    private Map<String, Object> view(Map<String, Object> row) {
        return new LinkedRowView(row, entitiesById::get);
    }

    private ResultSetHandle register(String entityType, List<Map<String, Object>> rows) {
        ensureOpen();
        ResultSetHandle handle = new ResultSetHandle("rs" + sequence.incrementAndGet(), entityType);
        resultSets.put(handle.getId(), new ResultSet(entityType, List.copyOf(rows)));
        return handle;
    }

    private ResultSet resultSet(ResultSetHandle handle) {
        ensureOpen();
        ResultSet resultSet = resultSets.get(handle.getId());
        if (resultSet == null) {
            throw new InternalInvariantException("unknown result set " + handle);
        }
        return resultSet;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("store is closed");
        }
    }

    private static final class ResultSet {
        private final String entityType;
        private final List<Map<String, Object>> rows;

        private ResultSet(String entityType, List<Map<String, Object>> rows) {
            this.entityType = entityType;
            this.rows = rows;
        }
    }
}
