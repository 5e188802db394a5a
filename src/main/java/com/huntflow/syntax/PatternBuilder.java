package com.huntflow.syntax;

import com.huntflow.pattern.Comparison;
import com.huntflow.pattern.Junction;
import com.huntflow.pattern.NullLiteral;
import com.huntflow.pattern.Operator;
import com.huntflow.pattern.PatternExpression;
import com.huntflow.pattern.PatternLiterals;
import com.huntflow.pattern.Reference;
import com.huntflow.statement.TimeRange;
import com.huntflow.store.RowValues;
import com.huntflow.syntax.parser.HuntflowParser;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds pattern trees, literal values and time ranges from parse-tree fragments
 */
class PatternBuilder {

    private final Clock clock;

    PatternBuilder(Clock clock) {
        this.clock = clock;
    }

    PatternExpression buildPattern(HuntflowParser.PatternContext ctx) {
        return buildDisjunction(ctx.disjunction());
    }

    private PatternExpression buildDisjunction(HuntflowParser.DisjunctionContext ctx) {
        List<HuntflowParser.ConjunctionContext> parts = ctx.conjunction();
        PatternExpression expr = buildConjunction(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            expr = new Junction(Junction.Kind.OR, expr, buildConjunction(parts.get(i)));
        }
        return expr;
    }

    private PatternExpression buildConjunction(HuntflowParser.ConjunctionContext ctx) {
        List<HuntflowParser.PredicateContext> parts = ctx.predicate();
        PatternExpression expr = buildPredicate(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            expr = new Junction(Junction.Kind.AND, expr, buildPredicate(parts.get(i)));
        }
        return expr;
    }

    private PatternExpression buildPredicate(HuntflowParser.PredicateContext ctx) {
        if (ctx instanceof HuntflowParser.GroupedPredicateContext) {
            return buildDisjunction(((HuntflowParser.GroupedPredicateContext) ctx).disjunction());
        }
        if (ctx instanceof HuntflowParser.BracketedPredicateContext) {
            return buildDisjunction(((HuntflowParser.BracketedPredicateContext) ctx).disjunction());
        }
        if (ctx instanceof HuntflowParser.NullPredicateContext) {
            HuntflowParser.NullPredicateContext nullCtx = (HuntflowParser.NullPredicateContext) ctx;
            String[] typeAndAttribute = splitAttributePath(nullCtx.attributePath());
            Operator op = nullCtx.NOT() != null ? Operator.NOT_EQUAL : Operator.EQUAL;
            return new Comparison(typeAndAttribute[0], typeAndAttribute[1], op, NullLiteral.INSTANCE);
        }
        HuntflowParser.ComparisonPredicateContext cmp = (HuntflowParser.ComparisonPredicateContext) ctx;
        String[] typeAndAttribute = splitAttributePath(cmp.attributePath());
        Operator op = Operator.fromSymbol(cmp.operator().children.stream()
                .map(ParseTree::getText)
                .collect(Collectors.joining(" ")));
        Object value = buildValue(cmp.value(), !op.isListOperator());
        return new Comparison(typeAndAttribute[0], typeAndAttribute[1], op, value);
    }

    /**
     * {@code type:attr} or bare {@code attr}; the type slot is null for the latter
     */
    private static String[] splitAttributePath(HuntflowParser.AttributePathContext ctx) {
        if (ctx.ENTITY_ATTRIBUTE_PATH() != null) {
            String text = ctx.ENTITY_ATTRIBUTE_PATH().getText();
            int colon = text.indexOf(':');
            return new String[]{text.substring(0, colon), text.substring(colon + 1)};
        }
        return new String[]{null, ctx.attribute().getText()};
    }

    /**
     * A literal, or a list of literals. Single-element lists collapse to a scalar when
     * {@code collapse} is set.
     */
    Object buildValue(HuntflowParser.ValueContext ctx, boolean collapse) {
        if (ctx.literal() != null) {
            return buildLiteral(ctx.literal());
        }
        List<Object> items = new ArrayList<>();
        for (HuntflowParser.LiteralContext literal : ctx.literalList().literal()) {
            items.add(buildLiteral(literal));
        }
        if (collapse && items.size() == 1) {
            return items.get(0);
        }
        return items;
    }

    Object buildLiteral(HuntflowParser.LiteralContext ctx) {
        Token token = ((TerminalNode) ctx.getChild(0)).getSymbol();
        String text = token.getText();
        switch (token.getType()) {
            case HuntflowParser.NUMBER:
                return parseNumber(token);
            case HuntflowParser.STRING:
                return PatternLiterals.unquote(text);
            case HuntflowParser.STIX_TIMESTAMP:
                return parseTimestamp(token);
            case HuntflowParser.TRUE:
                return Boolean.TRUE;
            case HuntflowParser.FALSE:
                return Boolean.FALSE;
            case HuntflowParser.NULL:
                return NullLiteral.INSTANCE;
            case HuntflowParser.ATTRIBUTE_PATH:
                Reference reference = Reference.parse(text);
                return reference != null ? reference : text;
            default:
                return text;
        }
    }

    /**
     * Integer first, floating point otherwise
     */
    static Number parseNumber(Token token) {
        String text = token.getText();
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException notAnInteger) {
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw invalidToken(token);
            }
        }
    }

    static int parseCount(TerminalNode node) {
        try {
            return Integer.parseInt(node.getText());
        } catch (NumberFormatException e) {
            throw invalidToken(node.getSymbol());
        }
    }

    TimeRange buildTimespan(HuntflowParser.TimespanContext ctx) {
        if (ctx instanceof HuntflowParser.AbsoluteTimespanContext) {
            HuntflowParser.AbsoluteTimespanContext absolute = (HuntflowParser.AbsoluteTimespanContext) ctx;
            Instant start = parseTimestamp(firstToken(absolute.timestamp(0)));
            Instant stop = parseTimestamp(firstToken(absolute.timestamp(1)));
            return new TimeRange(start, stop);
        }
        HuntflowParser.RelativeTimespanContext relative = (HuntflowParser.RelativeTimespanContext) ctx;
        long amount = parseCount(relative.NUMBER());
        Instant stop = clock.instant();
        return new TimeRange(stop.minus(amount, toChronoUnit(relative.timeUnit())), stop);
    }

    static ChronoUnit toChronoUnit(HuntflowParser.TimeUnitContext ctx) {
        switch (firstToken(ctx).getType()) {
            case HuntflowParser.DAY:
                return ChronoUnit.DAYS;
            case HuntflowParser.HOUR:
                return ChronoUnit.HOURS;
            case HuntflowParser.MINUTE:
                return ChronoUnit.MINUTES;
            default:
                return ChronoUnit.SECONDS;
        }
    }

    /**
     * ISO-8601, {@code t'..'} or quoted ISO-8601
     */
    static Instant parseTimestamp(Token token) {
        String text = token.getText();
        if (text.startsWith("t'")) {
            text = text.substring(1);
        }
        Instant instant = RowValues.toInstant(PatternLiterals.unquote(text));
        if (instant == null) {
            throw invalidToken(token);
        }
        return instant;
    }

    private static Token firstToken(ParseTree ctx) {
        ParseTree node = ctx;
        while (!(node instanceof TerminalNode)) {
            node = node.getChild(0);
        }
        return ((TerminalNode) node).getSymbol();
    }

    static HuntflowSyntaxException invalidToken(Token token, String... expected) {
        return new HuntflowSyntaxException(token.getLine(), token.getCharPositionInLine(),
                HuntflowSyntaxException.KIND_TOKEN, token.getText(), Set.of(expected));
    }
}
