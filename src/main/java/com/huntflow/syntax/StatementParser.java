package com.huntflow.syntax;

import com.huntflow.pattern.CenteredPattern;
import com.huntflow.session.SessionConfig;
import com.huntflow.statement.Statement;
import com.huntflow.statement.TimeRange;
import com.huntflow.syntax.parser.HuntflowLexer;
import com.huntflow.syntax.parser.HuntflowParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Huntflow front end: text to {@link Statement} list, or a stand-alone wire pattern to a
 * {@link ParsedPattern}.
 *
 * <p>Parsing stops at the first error with a {@link HuntflowSyntaxException} carrying
 * the expected-symbol set at the failure point.
 */
public class StatementParser {

    private static final Logger log = LoggerFactory.getLogger(StatementParser.class);

    private final Clock clock;

    public StatementParser() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock reference for relative timespans such as {@code LAST 5 MINUTES}
     */
    public StatementParser(Clock clock) {
        this.clock = clock;
    }

    public List<Statement> parse(String text, SessionConfig config) {
        // Parse the block to a tree, bailing on the first error
        HuntflowParser parser = newParser(text);
        HuntflowParser.HuntflowContext tree = parser.huntflow();

        // Build statements from the tree
        StatementBuilder builder = new StatementBuilder(config, new PatternBuilder(clock));
        List<Statement> statements = new ArrayList<>();
        for (HuntflowParser.StatementContext ctx : tree.statement()) {
            statements.add(builder.visit(ctx));
        }
        log.debug("Parsed {} statement(s)", statements.size());
        return statements;
    }

    /**
     * Parse {@code [pattern] [START t'..' STOP t'..']}
     */
    public ParsedPattern parsePattern(String text) {
        HuntflowParser parser = newParser(text);
        HuntflowParser.PatternSpecContext tree = parser.patternSpec();

        PatternBuilder builder = new PatternBuilder(clock);
        CenteredPattern pattern = new CenteredPattern(builder.buildPattern(tree.pattern()));
        TimeRange timeRange = tree.timespan() != null ? builder.buildTimespan(tree.timespan()) : null;
        return new ParsedPattern(pattern, timeRange);
    }

    private static HuntflowParser newParser(String text) {
        HuntflowLexer lexer = new HuntflowLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        HuntflowParser parser = new HuntflowParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.setErrorHandler(new ExpectedTokensErrorStrategy());
        return parser;
    }
}
