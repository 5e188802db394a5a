package com.huntflow.store;

import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loose value semantics of store rows: numbers compare numerically, timestamps
 * chronologically, everything else by string form. List-valued cells match when any
 * element does.
 */
public final class RowValues {

    private static final Logger log = LoggerFactory.getLogger(RowValues.class);

    private static final Pattern PLAIN_COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern LOOKS_LIKE_TIME = Pattern.compile("\\d{4}-\\d{2}-\\d{2}.*");

    private static final List<Function<String, Instant>> TIME_PARSERS = List.of(
            Instant::parse,
            text -> OffsetDateTime.parse(text).toInstant(),
            text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
            text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC));

    /**
     * Sort order for cell values; nulls last
     */
    public static final Comparator<Object> ORDER = Comparator.nullsLast(RowValues::compare);

    private RowValues() {
    }

    public static boolean anyEquals(Object actual, Object expected) {
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(a -> scalarEquals(a, expected));
        }
        return scalarEquals(actual, expected);
    }

    public static boolean scalarEquals(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue()) == 0;
        }
        if (a instanceof Instant || b instanceof Instant) {
            Instant x = toInstant(a);
            Instant y = toInstant(b);
            return x != null && x.equals(y);
        }
        return String.valueOf(a).equals(String.valueOf(b));
    }

    public static int compare(Object a, Object b) {
        if (a instanceof Collection || b instanceof Collection) {
            return String.valueOf(a).compareTo(String.valueOf(b));
        }
        if (a instanceof Number && b instanceof Number) {
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        }
        if (a instanceof Number || b instanceof Number) {
            Double x = toDouble(a);
            Double y = toDouble(b);
            if (x != null && y != null) {
                return Double.compare(x, y);
            }
        }
        if (a instanceof Instant || b instanceof Instant) {
            Instant x = toInstant(a);
            Instant y = toInstant(b);
            if (x != null && y != null) {
                return x.compareTo(y);
            }
        }
        return String.valueOf(a).compareTo(String.valueOf(b));
    }

    /**
     * SQL LIKE: {@code %} any run, {@code _} any single character; the whole value must match
     */
    public static boolean like(Object actual, String pattern) {
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(a -> like(a, pattern));
        }
        StringBuilder regex = new StringBuilder();
        for (char c : pattern.toCharArray()) {
            if (c == '%') {
                regex.append(".*");
            } else if (c == '_') {
                regex.append('.');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL).matcher(String.valueOf(actual)).matches();
    }

    public static boolean matches(Object actual, String regex, String filterText) {
        Pattern compiled;
        try {
            compiled = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new StorePatternException("invalid regular expression " + regex, filterText, e);
        }
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(a -> compiled.matcher(String.valueOf(a)).find());
        }
        Matcher m = compiled.matcher(String.valueOf(actual));
        return m.find();
    }

    /**
     * Whether an address falls inside a CIDR block; without a prefix length this is equality
     */
    public static boolean isSubset(Object actual, String cidr, String filterText) {
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).stream().anyMatch(a -> isSubset(a, cidr, filterText));
        }
        String network = cidr;
        int prefix = -1;
        int slash = cidr.indexOf('/');
        if (slash > 0) {
            network = cidr.substring(0, slash);
            try {
                prefix = Integer.parseInt(cidr.substring(slash + 1));
            } catch (NumberFormatException e) {
                throw new StorePatternException("invalid CIDR block " + cidr, filterText, e);
            }
        }
        String address = String.valueOf(actual);
        int addressSlash = address.indexOf('/');
        if (addressSlash > 0) {
            address = address.substring(0, addressSlash);
        }
        byte[] net = toAddressBytes(network);
        byte[] addr = toAddressBytes(address);
        if (net == null) {
            throw new StorePatternException("invalid network address " + cidr, filterText);
        }
        if (addr == null || addr.length != net.length) {
            return false;
        }
        int bits = net.length * 8;
        if (prefix < 0 || prefix > bits) {
            prefix = bits;
        }
        BigInteger mask = BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE)
                .shiftRight(bits - prefix).shiftLeft(bits - prefix);
        return new BigInteger(1, net).and(mask).equals(new BigInteger(1, addr).and(mask));
    }

    public static Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).trim();
        if (!LOOKS_LIKE_TIME.matcher(text).matches()) {
            return null;
        }
        for (Function<String, Instant> parser : TIME_PARSERS) {
            try {
                return parser.apply(text);
            } catch (DateTimeParseException e) {
                log.trace("'{}' is not in this timestamp form: {}", text, e.getMessage());
            }
        }
        return null;
    }

    public static Double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value == null) {
            return null;
        }
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static String quoteColumn(String column) {
        return PLAIN_COLUMN.matcher(column).matches() ? column : "\"" + column + "\"";
    }

    /**
     * Literal IPv4 dotted quads and IPv6 addresses only; never resolves host names
     */
    private static byte[] toAddressBytes(String literal) {
        if (!InetAddresses.isInetAddress(literal)) {
            return null;
        }
        return InetAddresses.forString(literal).getAddress();
    }
}
