package com.huntflow.pattern;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Literal rendering shared by the wire serializer and the SQL renderer
 */
public final class PatternLiterals {

    public static final DateTimeFormatter WIRE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private PatternLiterals() {
    }

    /**
     * Canonical wire spelling: quoted strings, {@code t'..'} timestamps, {@code (a,b)} lists
     */
    public static String toWire(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(PatternLiterals::toWire)
                    .collect(Collectors.joining(",", "(", ")"));
        }
        if (value instanceof Instant) {
            return "t'" + WIRE_TIMESTAMP.format((Instant) value) + "'";
        }
        if (value instanceof String) {
            return quote((String) value);
        }
        if (value instanceof Reference) {
            throw new InvalidPatternException("unresolved reference " + value);
        }
        return String.valueOf(value);
    }

    public static String toSql(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream()
                    .map(PatternLiterals::toSql)
                    .collect(Collectors.joining(", ", "(", ")"));
        }
        if (value instanceof Instant) {
            return "'" + WIRE_TIMESTAMP.format((Instant) value) + "'";
        }
        if (value instanceof String) {
            return "'" + ((String) value).replace("'", "''") + "'";
        }
        return String.valueOf(value);
    }

    public static String quote(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    /**
     * Inverse of {@link #quote}: strip the surrounding quotes and resolve backslash escapes
     */
    public static String unquote(String text) {
        if (text.length() < 2) {
            return text;
        }
        char first = text.charAt(0);
        if ((first != '\'' && first != '"') || text.charAt(text.length() - 1) != first) {
            return text;
        }
        String body = text.substring(1, text.length() - 1);
        StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '\\' && i + 1 < body.length()) {
                char next = body.charAt(++i);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        break;
                    case 't':
                        sb.append('\t');
                        break;
                    case 'r':
                        sb.append('\r');
                        break;
                    default:
                        sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
