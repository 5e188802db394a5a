package com.huntflow.semantics;

import com.huntflow.InternalInvariantException;
import com.huntflow.datasource.DataSourceRegistry;
import com.huntflow.pattern.CenteredPattern;
import com.huntflow.pattern.Reference;
import com.huntflow.pattern.ReferenceResolver;
import com.huntflow.relations.RelationCatalog;
import com.huntflow.relations.UnsupportedRelationException;
import com.huntflow.session.SessionConfig;
import com.huntflow.session.SymbolTable;
import com.huntflow.statement.ApplyStatement;
import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.FindStatement;
import com.huntflow.statement.GetStatement;
import com.huntflow.statement.LoadStatement;
import com.huntflow.statement.PatternStatement;
import com.huntflow.statement.ProjectionStatement;
import com.huntflow.statement.SaveStatement;
import com.huntflow.statement.Statement;
import com.huntflow.statement.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates and completes a parsed statement against the session state.
 *
 * <p>Runs in a fixed order: non-empty fields, variable existence, GET source, paths,
 * FIND relation, attribute selector, pattern compilation, APPLY arguments. The statement
 * is updated in place.
 */
public class SemanticResolver {

    private static final Logger log = LoggerFactory.getLogger(SemanticResolver.class);

    private final SessionConfig config;
    private final RelationCatalog catalog;
    private final DataSourceRegistry dataSources;

    public SemanticResolver(SessionConfig config, RelationCatalog catalog, DataSourceRegistry dataSources) {
        this.config = config;
        this.catalog = catalog;
        this.dataSources = dataSources;
    }

    public void resolve(Statement statement, SymbolTable symbolTable) {
        checkFieldsNotEmpty(statement);
        checkVariablesExist(statement, symbolTable);

        if (statement instanceof GetStatement) {
            resolveSource((GetStatement) statement, symbolTable);
        }
        if (statement instanceof LoadStatement) {
            LoadStatement load = (LoadStatement) statement;
            load.setPath(normalizePath(load.getPath()));
        }
        if (statement instanceof SaveStatement) {
            SaveStatement save = (SaveStatement) statement;
            save.setPath(normalizePath(save.getPath()));
        }
        if (statement instanceof FindStatement) {
            checkRelation((FindStatement) statement, symbolTable);
        }
        if (statement instanceof ProjectionStatement) {
            normalizeAttributes((ProjectionStatement) statement, symbolTable);
        }

        ReferenceResolver references = new SymbolTableReferenceResolver(symbolTable);
        if (statement instanceof PatternStatement && ((PatternStatement) statement).getWhere() != null) {
            compilePattern(statement, symbolTable, references);
        }
        if (statement instanceof ApplyStatement) {
            dereferenceArguments((ApplyStatement) statement, references);
        }
        log.debug("Resolved {}", statement);
    }

    private static void checkFieldsNotEmpty(Statement statement) {
        for (Map.Entry<String, String> field : statement.getStringFields().entrySet()) {
            if (field.getValue().isEmpty()) {
                throw new InternalInvariantException("incomplete parse: empty value for \"" + field.getKey() + "\"");
            }
        }
    }

    private static void checkVariablesExist(Statement statement, SymbolTable symbolTable) {
        Set<String> names = new LinkedHashSet<>(statement.getInputVariables());
        if (statement instanceof PatternStatement && ((PatternStatement) statement).getWhere() != null) {
            names.addAll(((PatternStatement) statement).getWhere().getReferencedVariables());
        }
        if (statement instanceof ApplyStatement) {
            for (Object value : ((ApplyStatement) statement).getArguments().values()) {
                for (Object item : asList(value)) {
                    if (item instanceof Reference) {
                        names.add(((Reference) item).getVariable());
                    }
                }
            }
        }
        for (String name : names) {
            symbolTable.require(name);
        }
    }

    /**
     * FROM may name a session variable rather than a source URI; without FROM the most
     * recently queried source is reused
     */
    private void resolveSource(GetStatement get, SymbolTable symbolTable) {
        String source = get.getDatasource();
        if (source != null && symbolTable.contains(source)) {
            get.setVariableSource(source);
            get.setDatasource(null);
            return;
        }
        if (source == null) {
            String last = dataSources.lastQueried().orElseThrow(() -> new SourceResolutionException(
                    "GET without FROM requires a previously queried data source"));
            log.debug("GET defaults to last queried source {}", last);
            get.setDatasource(last);
        }
    }

    static String normalizePath(String path) {
        String expanded = path;
        if (path.equals("~") || path.startsWith("~/")) {
            expanded = System.getProperty("user.home") + path.substring(1);
        }
        return Paths.get(expanded).toAbsolutePath().normalize().toString();
    }

    private void checkRelation(FindStatement find, SymbolTable symbolTable) {
        String inputType = symbolTable.require(find.getInput()).getEntityType();
        String returnType = find.getEntityType();
        String subject = find.isReversed() ? inputType : returnType;
        String object = find.isReversed() ? returnType : inputType;
        if (!catalog.supports(subject, find.getRelation(), object)) {
            throw new UnsupportedRelationException(subject, find.getRelation(), object);
        }
    }

    private static void normalizeAttributes(ProjectionStatement statement, SymbolTable symbolTable) {
        AttributeSelector selector = statement.getAttributes();
        if (selector.isAll()) {
            return;
        }
        String inputType = symbolTable.require(statement.getInput()).getEntityType();
        List<String> attributes = new ArrayList<>();
        for (String attribute : selector.getAttributes()) {
            int colon = attribute.lastIndexOf(':');
            if (colon >= 0) {
                String type = attribute.substring(0, colon);
                if (!type.isEmpty() && !type.equals(inputType)) {
                    throw new InvalidAttributeException(attribute, inputType);
                }
                attributes.add(attribute.substring(colon + 1));
            } else {
                attributes.add(attribute);
            }
        }
        statement.setAttributes(AttributeSelector.of(attributes));
    }

    private void compilePattern(Statement statement, SymbolTable symbolTable, ReferenceResolver references) {
        PatternStatement patternStatement = (PatternStatement) statement;
        String center = centerOf(statement, symbolTable);
        CenteredPattern pattern = patternStatement.getWhere().bindCenter(center).resolveReferences(references);
        patternStatement.setWhere(pattern);

        if (statement instanceof GetStatement) {
            GetStatement get = (GetStatement) statement;
            if (get.getVariableSource() != null) {
                get.setFilter(pattern.toBackendFilter(catalog));
            } else {
                get.setWirePattern(pattern.toWirePattern(window(get.getTimeRange(), pattern), catalog));
            }
        } else if (statement instanceof FindStatement) {
            ((FindStatement) statement).setFilter(pattern.toBackendFilter(catalog));
        } else if (statement instanceof ProjectionStatement) {
            ((ProjectionStatement) statement).setFilter(pattern.toBackendFilter(catalog));
        } else {
            throw new InternalInvariantException("no pattern compilation for " + statement.getCommand());
        }
    }

    /**
     * GET centers on its entity type; FIND and projections on the input variable's type
     */
    private static String centerOf(Statement statement, SymbolTable symbolTable) {
        if (statement instanceof GetStatement) {
            return ((GetStatement) statement).getEntityType();
        }
        if (statement instanceof FindStatement) {
            return symbolTable.require(((FindStatement) statement).getInput()).getEntityType();
        }
        if (statement instanceof ProjectionStatement) {
            return symbolTable.require(((ProjectionStatement) statement).getInput()).getEntityType();
        }
        throw new InternalInvariantException("no pattern center for " + statement.getCommand());
    }

    /**
     * Explicit timespan first; otherwise the references' window widened by the configured offsets
     */
    private TimeRange window(TimeRange explicit, CenteredPattern pattern) {
        if (explicit != null) {
            return explicit;
        }
        if (pattern.getWindow() != null) {
            return pattern.getWindow().widen(config.getTimerangeStartOffset(), config.getTimerangeStopOffset());
        }
        return null;
    }

    private static void dereferenceArguments(ApplyStatement apply, ReferenceResolver references) {
        for (Map.Entry<String, Object> argument : new ArrayList<>(apply.getArguments().entrySet())) {
            List<Object> values = new ArrayList<>();
            boolean dereferenced = false;
            for (Object item : asList(argument.getValue())) {
                if (item instanceof Reference) {
                    values.addAll(references.values((Reference) item));
                    dereferenced = true;
                } else {
                    values.add(item);
                }
            }
            if (dereferenced || argument.getValue() instanceof Collection) {
                apply.setArgument(argument.getKey(), values.size() == 1 ? values.get(0) : values);
            }
        }
    }

    private static List<Object> asList(Object value) {
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        List<Object> single = new ArrayList<>();
        single.add(value);
        return single;
    }
}
