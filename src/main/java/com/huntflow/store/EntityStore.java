package com.huntflow.store;

import com.huntflow.statement.Aggregation;
import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.GroupingSpec;
import com.huntflow.statement.Paging;
import com.huntflow.statement.SortSpec;
import com.huntflow.statement.TimeRange;
import com.huntflow.statement.Transform;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Backend that materializes entity rows and derives new result sets from existing ones.
 *
 * <p>Every derivation returns a fresh {@link ResultSetHandle}; existing result sets are
 * never modified, so several variables may safely share one handle. Rows are flat maps
 * whose nested attributes use dotted keys ({@code parent_ref.name}).
 */
public interface EntityStore extends AutoCloseable {

    /**
     * Add rows of one entity type; rows without an {@code id} get a generated one
     */
    ResultSetHandle insert(String entityType, List<Map<String, Object>> rows);

    /**
     * Rows of {@code source} matching {@code filter} (null keeps all), then sorted and paged
     *
     * @throws StorePatternException if the filter cannot be evaluated
     */
    ResultSetHandle filter(ResultSetHandle source, StoreFilter filter, SortSpec sort, Paging paging);

    /**
     * Same rows restricted to the selected attributes; {@code id} is always kept
     */
    ResultSetHandle project(ResultSetHandle source, AttributeSelector attributes);

    ResultSetHandle transform(ResultSetHandle source, Transform transform);

    /**
     * Entities of {@code returnType} connected to the rows of {@code source}.
     *
     * @param sourceRefs reference attributes on source rows pointing at returned entities
     * @param returnRefs reference attributes on returned entities pointing at source rows
     */
    ResultSetHandle related(ResultSetHandle source, String returnType, List<String> sourceRefs,
                            List<String> returnRefs);

    ResultSetHandle join(ResultSetHandle left, ResultSetHandle right, String leftAttribute, String rightAttribute);

    ResultSetHandle group(ResultSetHandle source, List<GroupingSpec> groupings, List<Aggregation> aggregations);

    /**
     * Union of result sets of the same entity type, de-duplicated by id
     */
    ResultSetHandle merge(List<ResultSetHandle> sources);

    List<Map<String, Object>> rows(ResultSetHandle handle, AttributeSelector attributes);

    /**
     * Distinct non-null values of an attribute in first-seen order; list cells are flattened
     */
    List<Object> values(ResultSetHandle handle, String attribute);

    long count(ResultSetHandle handle);

    /**
     * Earliest first observation to latest last observation of the rows, when timestamped
     */
    Optional<TimeRange> timeBounds(ResultSetHandle handle);

    /**
     * Attribute names seen on any stored entity of the type, sorted
     */
    List<String> attributes(String entityType);

    @Override
    void close();
}
