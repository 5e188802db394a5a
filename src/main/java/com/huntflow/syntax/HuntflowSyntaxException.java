package com.huntflow.syntax;

import com.huntflow.HuntflowException;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when huntflow text does not match the grammar.
 *
 * <p>Carries the position of the first offending input and the set of grammar symbols
 * that would have been legal there. Symbols are token names (e.g. {@code WHERE},
 * {@code LPAR}) or slot names such as {@code VARIABLE} and {@code ATTRIBUTE}.
 */
public class HuntflowSyntaxException extends HuntflowException {

    public static final String KIND_TOKEN = "token";
    public static final String KIND_CHARACTER = "character";
    public static final String KIND_END = "end of line";

    private final int line;
    private final int column;
    private final String kind;
    private final String fragment;
    private final Set<String> expected;

    public HuntflowSyntaxException(int line, int column, String kind, String fragment, Set<String> expected) {
        super(buildMessage(line, column, kind, fragment, expected));
        this.line = line;
        this.column = column;
        this.kind = kind;
        this.fragment = fragment;
        this.expected = Collections.unmodifiableSet(new TreeSet<>(expected));
    }

    private static String buildMessage(int line, int column, String kind, String fragment, Set<String> expected) {
        StringBuilder sb = new StringBuilder("unexpected ").append(kind);
        if (fragment != null && !fragment.isEmpty()) {
            sb.append(" \"").append(fragment).append('"');
        }
        sb.append(" at line ").append(line).append(", column ").append(column);
        if (!expected.isEmpty()) {
            sb.append("; expected one of ").append(new TreeSet<>(expected));
        }
        return sb.toString();
    }

    public int getLine() {
        return line;
    }

    /**
     * Zero-based column of the offending input
     */
    public int getColumn() {
        return column;
    }

    public String getKind() {
        return kind;
    }

    public String getFragment() {
        return fragment;
    }

    public Set<String> getExpected() {
        return expected;
    }
}
