package com.huntflow.completion;

import com.huntflow.session.HuntSession;
import com.huntflow.session.SymbolTable;
import com.huntflow.statement.AggregationFunction;
import com.huntflow.statement.AssignStatement;
import com.huntflow.statement.Statement;
import com.huntflow.statement.Transform;
import com.huntflow.syntax.ExpectedSymbolCollector;
import com.huntflow.syntax.HuntflowSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level completion of partial huntflow code.
 *
 * <p>Candidates come from the parser itself: the text before the partial word is parsed
 * with a trailing sentinel, and the symbols expected at the sentinel are mapped to
 * keywords, punctuation, variables, entity types, relations, attributes, data source
 * and analytics URIs. Returned strings complete the partial word, so they exclude
 * what has already been typed.
 */
public class CompletionEngine {

    private static final Logger log = LoggerFactory.getLogger(CompletionEngine.class);

    private static final Pattern TIMESPAN_KEYWORD = Pattern.compile("\\b(START|STOP)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String SCHEME_SEPARATOR = "://";
    private static final String SENTINEL = " @";

    private static final String TIMESTAMP_TEMPLATE = "0000-01-01T00:00:00";
    private static final Set<Integer> TIMESTAMP_PREFIX_LENGTHS = Set.of(4, 7, 10, 13, 16, 19);

    private static final Set<String> VALUE_TOKENS = Set.of(
            "NUMBER", "STRING", "URI", "PATH", "ISO_TIMESTAMP", "STIX_TIMESTAMP", "IDENTIFIER",
            "ATTRIBUTE_PATH", "ENTITY_ATTRIBUTE_PATH", "HYPHENATED_ID", "EOF");

    private static final Map<String, String> PUNCTUATION = Map.ofEntries(
            Map.entry("EQUAL", "="),
            Map.entry("PLUS", "+"),
            Map.entry("LSQB", "["),
            Map.entry("LPAR", "("),
            Map.entry("COMMA", ","),
            Map.entry("NEQ", "!="),
            Map.entry("LT", "<"),
            Map.entry("LE", "<="),
            Map.entry("GT", ">"),
            Map.entry("GE", ">="),
            Map.entry("RPAR", ")"),
            Map.entry("RSQB", "]"),
            Map.entry("COLON", ":"),
            Map.entry("LBRACE", "{"),
            Map.entry("RBRACE", "}"));

    private static final Pattern KEYWORD = Pattern.compile("[A-Z]+");

    public List<String> complete(String code, int cursor, HuntSession session) {
        String prefix = code.substring(0, Math.max(0, Math.min(cursor, code.length())));
        int split = lastWhitespace(prefix);
        String lastWord = prefix.substring(split + 1);
        String head = prefix.substring(0, split + 1);
        log.debug("Completing prefix=\"{}\" lastWord=\"{}\"", prefix, lastWord);

        if (TIMESPAN_KEYWORD.matcher(prefix).find()) {
            return completeTimestamp(lastWord);
        }

        Collection<String> candidates;
        if (lastWord.contains(SCHEME_SEPARATOR)) {
            candidates = uriCandidates(lastWord.substring(0, lastWord.indexOf(SCHEME_SEPARATOR)), session);
        } else {
            List<String> bare = completeBareVariable(prefix, lastWord, session);
            if (bare != null) {
                return bare;
            }
            candidates = expectedCandidates(head, lastWord, session);
        }
        return strip(candidates, lastWord);
    }

    /**
     * Fills a partial ISO-8601 timestamp up to seconds; the suffix closes a STIX
     * timestamp quote when one was opened
     */
    static List<String> completeTimestamp(String word) {
        int quote = word.lastIndexOf('\'');
        String partial = quote >= 0 ? word.substring(quote + 1) : word;
        if (!TIMESTAMP_PREFIX_LENGTHS.contains(partial.length())) {
            return Collections.emptyList();
        }
        String suffix = TIMESTAMP_TEMPLATE.substring(partial.length());
        try {
            LocalDateTime.parse(partial + suffix);
        } catch (DateTimeParseException e) {
            log.debug("No timestamp completion for \"{}\": {}", partial, e.getMessage());
            return Collections.emptyList();
        }
        return List.of(suffix + (quote >= 0 ? "Z'" : "Z"));
    }

    private static List<String> uriCandidates(String scheme, HuntSession session) {
        List<String> names = new ArrayList<>();
        if (session.getDataSources().schemes().contains(scheme)) {
            session.getDataSources().listDataSources(scheme).forEach(name -> names.add(scheme + SCHEME_SEPARATOR + name));
        } else if (session.getAnalytics().schemes().contains(scheme)) {
            session.getAnalytics().listAnalytics(scheme).forEach(name -> names.add(scheme + SCHEME_SEPARATOR + name));
        } else {
            log.debug("No data source or analytics registered for scheme {}", scheme);
        }
        return names;
    }

    /**
     * A lone variable name parses as an assignment to the default variable; complete the
     * name, or offer the operators that may follow it
     *
     * @return null when the prefix is not a lone name
     */
    private static List<String> completeBareVariable(String prefix, String lastWord, HuntSession session) {
        if (prefix.isBlank() || prefix.trim().split("\\s+").length != 1) {
            return null;
        }
        List<Statement> statements;
        try {
            statements = session.parse(prefix);
        } catch (HuntflowSyntaxException e) {
            log.debug("Prefix is not a complete statement: {}", e.getMessage());
            return null;
        }
        if (statements.isEmpty()) {
            return null;
        }
        Statement last = statements.get(statements.size() - 1);
        if (!(last instanceof AssignStatement) || !((AssignStatement) last).isBare()
                || !session.getConfig().getDefaultVariable().equals(last.getOutput())) {
            return null;
        }
        if (lastWord.isEmpty()) {
            return List.of("+", "=");
        }
        return strip(session.getVariableNames(), lastWord);
    }

    private Collection<String> expectedCandidates(String head, String lastWord, HuntSession session) {
        Set<String> expected;
        try {
            session.parse(head + SENTINEL);
            log.debug("Sentinel unexpectedly parsed after \"{}\"", head);
            return Collections.emptyList();
        } catch (HuntflowSyntaxException e) {
            expected = e.getExpected();
        }
        log.debug("Expected at completion point: {}", expected);

        boolean lowerCase = !lastWord.isEmpty() && lastWord.equals(lastWord.toLowerCase(Locale.ROOT));
        List<String> candidates = new ArrayList<>();
        for (String symbol : expected) {
            switch (symbol) {
                case ExpectedSymbolCollector.VARIABLE:
                    candidates.addAll(session.getVariableNames());
                    break;
                case ExpectedSymbolCollector.DATASRC:
                    session.getDataSources().schemes().forEach(scheme -> candidates.add(scheme + SCHEME_SEPARATOR));
                    candidates.addAll(session.getVariableNames());
                    break;
                case ExpectedSymbolCollector.ANALYTICS:
                    session.getAnalytics().schemes().forEach(scheme -> candidates.add(scheme + SCHEME_SEPARATOR));
                    break;
                case ExpectedSymbolCollector.ENTITY_TYPE:
                    candidates.addAll(session.getCatalog().getEntityTypes());
                    break;
                case ExpectedSymbolCollector.RELATION:
                    candidates.addAll(session.getCatalog().relationNames());
                    break;
                case ExpectedSymbolCollector.ATTRIBUTE:
                    candidates.addAll(attributesOfLastVariable(head, session));
                    break;
                case ExpectedSymbolCollector.FUNCNAME:
                    candidates.addAll(AggregationFunction.names());
                    break;
                case ExpectedSymbolCollector.TRANSFORM:
                    candidates.addAll(Transform.names());
                    break;
                default:
                    if (PUNCTUATION.containsKey(symbol)) {
                        candidates.add(PUNCTUATION.get(symbol));
                    } else if (!VALUE_TOKENS.contains(symbol) && KEYWORD.matcher(symbol).matches()) {
                        candidates.add(lowerCase ? symbol.toLowerCase(Locale.ROOT) : symbol);
                    }
            }
        }
        return candidates;
    }

    /**
     * Attributes of the entity type of the variable mentioned last before the cursor
     */
    private static List<String> attributesOfLastVariable(String head, HuntSession session) {
        SymbolTable symbolTable = session.getSymbolTable();
        List<String> words = new ArrayList<>();
        Matcher matcher = WORD.matcher(head);
        while (matcher.find()) {
            words.add(matcher.group());
        }
        for (int i = words.size() - 1; i >= 0; i--) {
            if (symbolTable.contains(words.get(i))) {
                String entityType = symbolTable.require(words.get(i)).getEntityType();
                return session.getStore().attributes(entityType);
            }
        }
        return Collections.emptyList();
    }

    private static List<String> strip(Collection<String> candidates, String lastWord) {
        Set<String> completions = new TreeSet<>();
        for (String candidate : candidates) {
            // an exact match completes to the empty string: the word is already whole
            if (candidate.startsWith(lastWord)) {
                completions.add(candidate.substring(lastWord.length()));
            }
        }
        return new ArrayList<>(completions);
    }

    private static int lastWhitespace(String text) {
        for (int i = text.length() - 1; i >= 0; i--) {
            if (Character.isWhitespace(text.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
