package com.huntflow.commands;

import com.huntflow.InternalInvariantException;
import com.huntflow.session.HuntSession;
import com.huntflow.session.VariableBinding;
import com.huntflow.statement.Command;
import com.huntflow.statement.GetStatement;
import com.huntflow.statement.Paging;
import com.huntflow.store.EntityStore;
import com.huntflow.store.EntityTypeMismatchException;
import com.huntflow.store.ResultSetHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * GET from a data source URI, or filtering of an existing variable of the same type
 */
public class GetHandler extends AbstractCommandHandler<GetStatement> {

    private static final Logger log = LoggerFactory.getLogger(GetHandler.class);

    public GetHandler() {
        super(Command.GET, GetStatement.class);
    }

    @Override
    protected CommandResult doHandle(GetStatement statement, HuntSession session) {
        EntityStore store = session.getStore();
        Paging paging = Paging.of(statement.getLimit(), null);

        if (statement.getVariableSource() != null) {
            VariableBinding source = session.getSymbolTable().require(statement.getVariableSource());
            if (!source.getEntityType().equals(statement.getEntityType())) {
                throw new EntityTypeMismatchException(statement.getEntityType(), source.getEntityType());
            }
            return bind(store.filter(source.getHandle(), statement.getFilter(), null, paging), session);
        }

        if (statement.getWirePattern() == null) {
            throw new InternalInvariantException("GET from " + statement.getDatasource() + " has no compiled pattern");
        }
        List<Map<String, Object>> rows = session.getDataSources()
                .query(statement.getDatasource(), statement.getWirePattern());
        log.debug("GET {} returned {} row(s) from {}", statement.getEntityType(), rows.size(),
                statement.getDatasource());
        ResultSetHandle handle = store.insert(statement.getEntityType(), rows);
        if (!paging.isEmpty()) {
            handle = store.filter(handle, null, null, paging);
        }
        return bind(handle, session);
    }
}
