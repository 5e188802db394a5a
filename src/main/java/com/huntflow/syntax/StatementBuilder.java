package com.huntflow.syntax;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.pattern.PatternLiterals;
import com.huntflow.session.SessionConfig;
import com.huntflow.statement.Aggregation;
import com.huntflow.statement.AggregationFunction;
import com.huntflow.statement.ApplyStatement;
import com.huntflow.statement.AssignStatement;
import com.huntflow.statement.AttributeSelector;
import com.huntflow.statement.BinnedAttribute;
import com.huntflow.statement.DispStatement;
import com.huntflow.statement.FindStatement;
import com.huntflow.statement.GetStatement;
import com.huntflow.statement.GroupAttribute;
import com.huntflow.statement.GroupStatement;
import com.huntflow.statement.GroupingSpec;
import com.huntflow.statement.InfoStatement;
import com.huntflow.statement.JoinStatement;
import com.huntflow.statement.LoadStatement;
import com.huntflow.statement.MergeStatement;
import com.huntflow.statement.NewStatement;
import com.huntflow.statement.Paging;
import com.huntflow.statement.SaveStatement;
import com.huntflow.statement.SortSpec;
import com.huntflow.statement.SortStatement;
import com.huntflow.statement.Statement;
import com.huntflow.statement.TimeRange;
import com.huntflow.statement.Transform;
import com.huntflow.syntax.parser.HuntflowBaseVisitor;
import com.huntflow.syntax.parser.HuntflowParser;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ANTLR visitor turning a huntflow parse tree into {@link Statement} objects
 */
public class StatementBuilder extends HuntflowBaseVisitor<Statement> {

    private final SessionConfig config;
    private final PatternBuilder patterns;

    StatementBuilder(SessionConfig config, PatternBuilder patterns) {
        this.config = config;
        this.patterns = patterns;
    }

    @Override
    public Statement visitAssignmentStatement(HuntflowParser.AssignmentStatementContext ctx) {
        Statement statement = visit(ctx.expression());
        String output = ctx.variable() != null ? ctx.variable().getText() : config.getDefaultVariable();
        statement.setOutput(output);
        return statement;
    }

    @Override
    public Statement visitCommandStatement(HuntflowParser.CommandStatementContext ctx) {
        return visit(ctx.command());
    }

    @Override
    public Statement visitGetCommand(HuntflowParser.GetCommandContext ctx) {
        String datasource = ctx.datasource() != null ? extractDatasource(ctx.datasource()) : null;
        return new GetStatement(
                ctx.entityType().getText(),
                datasource,
                extractPattern(ctx.whereClause()),
                extractTimeRange(ctx.timespan()),
                extractLimit(ctx.limitClause()));
    }

    @Override
    public Statement visitFindCommand(HuntflowParser.FindCommandContext ctx) {
        return new FindStatement(
                ctx.entityType().getText(),
                ctx.relation().getText().toLowerCase(Locale.ROOT),
                ctx.BY() != null,
                ctx.variable().getText(),
                extractPattern(ctx.whereClause()),
                extractTimeRange(ctx.timespan()),
                extractLimit(ctx.limitClause()));
    }

    @Override
    public Statement visitJoinCommand(HuntflowParser.JoinCommandContext ctx) {
        List<HuntflowParser.AttributeContext> attributes = ctx.attribute();
        return new JoinStatement(
                ctx.variable(0).getText(),
                ctx.variable(1).getText(),
                attributes.isEmpty() ? null : attributes.get(0).getText(),
                attributes.isEmpty() ? null : attributes.get(1).getText());
    }

    @Override
    public Statement visitSortCommand(HuntflowParser.SortCommandContext ctx) {
        SortSpec sort = new SortSpec(ctx.attribute().getText(), extractAscending(ctx.sortDirection()));
        return new SortStatement(ctx.variable().getText(), sort,
                Paging.of(extractLimit(ctx.limitClause()), extractOffset(ctx.offsetClause())));
    }

    @Override
    public Statement visitGroupCommand(HuntflowParser.GroupCommandContext ctx) {
        List<GroupingSpec> groupings = new ArrayList<>();
        for (HuntflowParser.GroupExprContext expr : ctx.groupExpr()) {
            groupings.add(extractGrouping(expr));
        }
        List<Aggregation> aggregations = new ArrayList<>();
        for (HuntflowParser.AggregationContext agg : ctx.aggregation()) {
            aggregations.add(extractAggregation(agg));
        }
        return new GroupStatement(ctx.variable().getText(), groupings, aggregations);
    }

    @Override
    public Statement visitLoadCommand(HuntflowParser.LoadCommandContext ctx) {
        String entityType = ctx.entityType() != null ? ctx.entityType().getText() : null;
        return new LoadStatement(extractPath(ctx.path()), entityType);
    }

    @Override
    public Statement visitNewCommand(HuntflowParser.NewCommandContext ctx) {
        String entityType = ctx.entityType() != null ? ctx.entityType().getText() : null;
        return new NewStatement(entityType, extractJsonArray(ctx.jsonArray()));
    }

    @Override
    public Statement visitMergeCommand(HuntflowParser.MergeCommandContext ctx) {
        return new MergeStatement(ctx.variable().stream()
                .map(HuntflowParser.VariableContext::getText)
                .collect(Collectors.toList()));
    }

    @Override
    public Statement visitAssignCommand(HuntflowParser.AssignCommandContext ctx) {
        HuntflowParser.EntitySourceContext source = ctx.entitySource();
        return new AssignStatement(
                extractInput(source),
                extractTransform(source),
                extractPattern(ctx.whereClause()),
                extractAttributes(ctx.attrClause()),
                extractSort(ctx.sortClause()),
                Paging.of(extractLimit(ctx.limitClause()), extractOffset(ctx.offsetClause())));
    }

    @Override
    public Statement visitDispCommand(HuntflowParser.DispCommandContext ctx) {
        HuntflowParser.EntitySourceContext source = ctx.entitySource();
        return new DispStatement(
                extractInput(source),
                extractTransform(source),
                extractPattern(ctx.whereClause()),
                extractAttributes(ctx.attrClause()),
                extractSort(ctx.sortClause()),
                Paging.of(extractLimit(ctx.limitClause()), extractOffset(ctx.offsetClause())));
    }

    @Override
    public Statement visitInfoCommand(HuntflowParser.InfoCommandContext ctx) {
        return new InfoStatement(ctx.variable().getText());
    }

    @Override
    public Statement visitSaveCommand(HuntflowParser.SaveCommandContext ctx) {
        return new SaveStatement(ctx.variable().getText(), extractPath(ctx.path()));
    }

    @Override
    public Statement visitApplyCommand(HuntflowParser.ApplyCommandContext ctx) {
        List<String> inputs = ctx.variable().stream()
                .map(HuntflowParser.VariableContext::getText)
                .collect(Collectors.toList());
        Map<String, Object> arguments = new LinkedHashMap<>();
        for (HuntflowParser.ArgumentContext arg : ctx.argument()) {
            arguments.put(arg.IDENTIFIER().getText(), patterns.buildValue(arg.value(), true));
        }
        return new ApplyStatement(extractQuotable(ctx.analyticsUri().getChild(0)), inputs, arguments);
    }

    /**
     * Extract the input variable of {@code var} or {@code TRANSFORM(var)}
     */
    private static String extractInput(HuntflowParser.EntitySourceContext ctx) {
        if (ctx.transform() != null) {
            return ctx.transform().variable().getText();
        }
        return ctx.variable().getText();
    }

    private static Transform extractTransform(HuntflowParser.EntitySourceContext ctx) {
        if (ctx.transform() == null) {
            return null;
        }
        HuntflowParser.TransformNameContext name = ctx.transform().transformName();
        return Transform.fromName(name.getText())
                .orElseThrow(() -> PatternBuilder.invalidToken(name.getStart(), ExpectedSymbolCollector.TRANSFORM));
    }

    private CenteredPattern extractPattern(HuntflowParser.WhereClauseContext ctx) {
        if (ctx == null) {
            return null;
        }
        return new CenteredPattern(patterns.buildPattern(ctx.pattern()));
    }

    private TimeRange extractTimeRange(HuntflowParser.TimespanContext ctx) {
        return ctx != null ? patterns.buildTimespan(ctx) : null;
    }

    private static Integer extractLimit(HuntflowParser.LimitClauseContext ctx) {
        return ctx != null ? PatternBuilder.parseCount(ctx.NUMBER()) : null;
    }

    private static Integer extractOffset(HuntflowParser.OffsetClauseContext ctx) {
        return ctx != null ? PatternBuilder.parseCount(ctx.NUMBER()) : null;
    }

    private static AttributeSelector extractAttributes(HuntflowParser.AttrClauseContext ctx) {
        if (ctx == null) {
            return AttributeSelector.all();
        }
        return AttributeSelector.of(ctx.attrName().stream()
                .map(HuntflowParser.AttrNameContext::getText)
                .collect(Collectors.toList()));
    }

    private SortSpec extractSort(HuntflowParser.SortClauseContext ctx) {
        if (ctx == null) {
            return null;
        }
        return new SortSpec(ctx.attribute().getText(), extractAscending(ctx.sortDirection()));
    }

    private boolean extractAscending(HuntflowParser.SortDirectionContext ctx) {
        if (ctx == null) {
            return config.isDefaultSortAscending();
        }
        return ctx.ASC() != null;
    }

    private static GroupingSpec extractGrouping(HuntflowParser.GroupExprContext ctx) {
        if (ctx instanceof HuntflowParser.GroupByAttributeContext) {
            return new GroupAttribute(((HuntflowParser.GroupByAttributeContext) ctx).attribute().getText());
        }
        HuntflowParser.GroupByBinContext bin = (HuntflowParser.GroupByBinContext) ctx;
        long width = PatternBuilder.parseCount(bin.NUMBER());
        if (width <= 0) {
            throw PatternBuilder.invalidToken(bin.NUMBER().getSymbol());
        }
        String alias = bin.IDENTIFIER() != null ? bin.IDENTIFIER().getText() : null;
        return new BinnedAttribute(
                bin.attribute().getText(),
                width,
                bin.timeUnit() != null ? PatternBuilder.toChronoUnit(bin.timeUnit()) : null,
                alias);
    }

    private static Aggregation extractAggregation(HuntflowParser.AggregationContext ctx) {
        HuntflowParser.FuncNameContext name = ctx.funcName();
        AggregationFunction function = AggregationFunction.fromName(name.getText())
                .orElseThrow(() -> PatternBuilder.invalidToken(name.getStart(), ExpectedSymbolCollector.FUNCNAME));
        String alias = ctx.IDENTIFIER() != null ? ctx.IDENTIFIER().getText() : null;
        return new Aggregation(function, ctx.attribute().getText(), alias);
    }

    /**
     * One or more comma separated URIs; a quoted source may contain spaces
     */
    private static String extractDatasource(HuntflowParser.DatasourceContext ctx) {
        String raw = ctx.name() != null ? ctx.name().getText() : extractQuotable(ctx.getChild(0));
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.joining(","));
    }

    private static String extractPath(HuntflowParser.PathContext ctx) {
        return extractQuotable(ctx.getChild(0));
    }

    private static String extractQuotable(ParseTree node) {
        TerminalNode terminal = (TerminalNode) node;
        if (terminal.getSymbol().getType() == HuntflowParser.STRING) {
            return PatternLiterals.unquote(terminal.getText());
        }
        return terminal.getText();
    }

    private static List<Object> extractJsonArray(HuntflowParser.JsonArrayContext ctx) {
        List<Object> items = new ArrayList<>();
        for (HuntflowParser.JsonValueContext value : ctx.jsonValue()) {
            items.add(extractJsonValue(value));
        }
        return items;
    }

    private static Object extractJsonValue(HuntflowParser.JsonValueContext ctx) {
        if (ctx.jsonObject() != null) {
            Map<String, Object> object = new LinkedHashMap<>();
            for (HuntflowParser.JsonMemberContext member : ctx.jsonObject().jsonMember()) {
                object.put(PatternLiterals.unquote(member.STRING().getText()), extractJsonValue(member.jsonValue()));
            }
            return object;
        }
        if (ctx.jsonArray() != null) {
            return extractJsonArray(ctx.jsonArray());
        }
        TerminalNode terminal = (TerminalNode) ctx.getChild(0);
        switch (terminal.getSymbol().getType()) {
            case HuntflowParser.STRING:
                return PatternLiterals.unquote(terminal.getText());
            case HuntflowParser.NUMBER:
                return PatternBuilder.parseNumber(terminal.getSymbol());
            case HuntflowParser.TRUE:
                return Boolean.TRUE;
            case HuntflowParser.FALSE:
                return Boolean.FALSE;
            default:
                return null;
        }
    }
}
