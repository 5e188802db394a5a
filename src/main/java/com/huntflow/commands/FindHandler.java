package com.huntflow.commands;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.pattern.Comparison;
import com.huntflow.pattern.Junction;
import com.huntflow.pattern.Operator;
import com.huntflow.pattern.PatternExpression;
import com.huntflow.relations.RefMapping;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.FindStatement;
import com.huntflow.statement.Paging;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.EntityRows;
import com.huntflow.store.EntityStore;
import com.huntflow.store.ResultSetHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * FIND entities connected to a variable through a relation.
 *
 * <p>WHERE narrows the input variable's entities before any connection is followed. When
 * a data source has been queried in this session, the connected entities are first
 * fetched from it, constrained by id and by reference attributes. Connections are then
 * followed in the store and LIMIT applied.
 */
public class FindHandler extends AbstractCommandHandler<FindStatement> {

    private static final Logger log = LoggerFactory.getLogger(FindHandler.class);

    public FindHandler() {
        super(Command.FIND, FindStatement.class);
    }

    @Override
    protected CommandResult doHandle(FindStatement statement, HuntSession session) {
        EntityStore store = session.getStore();
        VariableBinding input = session.getSymbolTable().require(statement.getInput());
        String returnType = statement.getEntityType();
        if (statement.getFilter() != null) {
            input = new VariableBinding(store.filter(input.getHandle(), statement.getFilter(), null, Paging.none()), store);
            log.debug("FIND follows {} of the {} entities in {}", input.getCount(), input.getEntityType(),
                    statement.getInput());
        }

        List<String> sourceRefs;
        List<String> returnRefs;
        Optional<RefMapping> mapping = lookup(session.getCatalog(), statement, input.getEntityType());
        if (mapping.isPresent()) {
            // source rows are the subject of a reversed relation
            sourceRefs = statement.isReversed() ? mapping.get().getSubjectRefs() : mapping.get().getObjectRefs();
            returnRefs = statement.isReversed() ? mapping.get().getObjectRefs() : mapping.get().getSubjectRefs();
        } else {
            sourceRefs = referenceAttributes(store, input.getEntityType());
            returnRefs = referenceAttributes(store, returnType);
        }

        Optional<String> datasource = session.getDataSources().lastQueried();
        if (datasource.isPresent()) {
            prefetch(statement, session, input, datasource.get(), sourceRefs, returnRefs);
        }

        ResultSetHandle handle = store.related(input.getHandle(), returnType, sourceRefs, returnRefs);
        Paging paging = Paging.of(statement.getLimit(), null);
        if (!paging.isEmpty()) {
            handle = store.filter(handle, null, null, paging);
        }
        return bind(handle, session);
    }

    private static Optional<RefMapping> lookup(RelationCatalog catalog, FindStatement statement, String inputType) {
        if (statement.isReversed()) {
            return catalog.lookup(inputType, statement.getRelation(), statement.getEntityType());
        }
        return catalog.lookup(statement.getEntityType(), statement.getRelation(), inputType);
    }

    private static List<String> referenceAttributes(EntityStore store, String entityType) {
        return store.attributes(entityType).stream()
                .filter(EntityRows::isReferenceAttribute)
                .collect(Collectors.toList());
    }

    private void prefetch(FindStatement statement, HuntSession session, VariableBinding input, String datasource,
                          List<String> sourceRefs, List<String> returnRefs) {
        String returnType = statement.getEntityType();
        Set<Object> targetIds = new LinkedHashSet<>();
        for (String ref : sourceRefs) {
            input.getValues(ref).forEach(value -> targetIds.addAll(EntityRows.referencedIds(value)));
        }
        List<Object> sourceIds = input.getValues(EntityRows.ID);

        PatternExpression connected = null;
        if (!targetIds.isEmpty()) {
            connected = new Comparison(returnType, EntityRows.ID, Operator.IN, new ArrayList<>(targetIds));
        }
        if (!sourceIds.isEmpty()) {
            for (String ref : returnRefs) {
                connected = or(connected, new Comparison(returnType, ref, Operator.IN, sourceIds));
            }
        }
        if (connected == null) {
            log.debug("Nothing to fetch for FIND {} {} {}", returnType, statement.getRelation(), statement.getInput());
            return;
        }
        String wirePattern = new CenteredPattern(connected).bindCenter(returnType)
                .toWirePattern(window(statement, session, input), session.getCatalog());
        List<Map<String, Object>> rows = session.getDataSources().query(datasource, wirePattern);
        log.debug("FIND fetched {} {} row(s) from {}", rows.size(), returnType, datasource);
        session.getStore().insert(returnType, rows);
    }

    private static PatternExpression or(PatternExpression left, PatternExpression right) {
        return left == null ? right : new Junction(Junction.Kind.OR, left, right);
    }

    private static TimeRange window(FindStatement statement, HuntSession session, VariableBinding input) {
        if (statement.getTimeRange() != null) {
            return statement.getTimeRange();
        }
        return input.getTimeBounds()
                .map(bounds -> bounds.widen(session.getConfig().getTimerangeStartOffset(),
                        session.getConfig().getTimerangeStopOffset()))
                .orElse(null);
    }
}
