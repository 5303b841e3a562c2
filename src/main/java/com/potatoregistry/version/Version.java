package com.potatoregistry.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A package version with a total order.
 *
 * <p>The string is split into a release part (the leading numeric items) and a tail of qualifiers
 * and further numbers. Release parts compare numerically with missing components counting as zero,
 * so {@code 1.0} and {@code 1.0.0} have the same precedence. Tails compare item by item:
 * <pre>
 *   dev, snapshot  &lt;  alpha, a  &lt;  beta, b  &lt;  milestone, m  &lt;  rc, cr, c, pre, preview
 *   &lt;  (nothing), ga, final, release  &lt;  post, sp, patch, rev, r  &lt;  any other word
 * </pre>
 * and a number beats any word. Versions of equal precedence are ordered by their raw text,
 * which keeps {@link #compareTo} consistent with {@link #equals}.
 */
public final class Version implements Comparable<Version> {

    public static final int MAX_LENGTH = 64;

    private static final Pattern VALID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._+!-]*");

    private static final int RELEASE_RANK = 5;
    private static final int UNKNOWN_RANK = 7;
    private static final Map<String, Integer> QUALIFIER_RANKS = Map.ofEntries(
            Map.entry("dev", 0), Map.entry("snapshot", 0),
            Map.entry("alpha", 1), Map.entry("a", 1),
            Map.entry("beta", 2), Map.entry("b", 2),
            Map.entry("milestone", 3), Map.entry("m", 3),
            Map.entry("rc", 4), Map.entry("cr", 4), Map.entry("c", 4), Map.entry("pre", 4), Map.entry("preview", 4),
            Map.entry("ga", RELEASE_RANK), Map.entry("final", RELEASE_RANK), Map.entry("release", RELEASE_RANK),
            Map.entry("post", 6), Map.entry("sp", 6), Map.entry("patch", 6), Map.entry("rev", 6), Map.entry("r", 6));

    private final String raw;
    private final List<BigInteger> release;
    private final List<Object> tail;      // BigInteger or lower-case String

    private Version(String raw, List<BigInteger> release, List<Object> tail) {
        this.raw = raw;
        this.release = release;
        this.tail = tail;
    }

    public static boolean isValid(String s) {
        return s != null && s.length() <= MAX_LENGTH && VALID.matcher(s).matches();
    }

    public static Version parse(String s) {
        if (!isValid(s)) throw new IllegalArgumentException("invalid version: " + s);

        List<Object> items = tokenize(s);
        int i = 0;
        List<BigInteger> release = new ArrayList<>();
        while (i < items.size() && items.get(i) instanceof BigInteger n) {
            release.add(n);
            i++;
        }
        List<Object> tail = new ArrayList<>(items.subList(i, items.size()));

        while (!release.isEmpty() && release.get(release.size() - 1).signum() == 0) {
            release.remove(release.size() - 1);
        }
        while (!tail.isEmpty() && isReleaseEquivalent(tail.get(tail.size() - 1))) {
            tail.remove(tail.size() - 1);
        }
        return new Version(s, Collections.unmodifiableList(release), Collections.unmodifiableList(tail));
    }

    private static List<Object> tokenize(String s) {
        List<Object> items = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean digits = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            boolean sep = c == '.' || c == '-' || c == '_' || c == '+' || c == '!';
            boolean isDigit = c >= '0' && c <= '9';
            if (sep || (cur.length() > 0 && isDigit != digits)) {
                flush(cur, digits, items);
            }
            if (!sep) {
                if (cur.length() == 0) digits = isDigit;
                cur.append(c);
            }
        }
        flush(cur, digits, items);
        return items;
    }

    private static void flush(StringBuilder cur, boolean digits, List<Object> items) {
        if (cur.length() == 0) return;
        String t = cur.toString();
        items.add(digits ? new BigInteger(t) : t.toLowerCase(Locale.ROOT));
        cur.setLength(0);
    }

    private static boolean isReleaseEquivalent(Object item) {
        if (item instanceof BigInteger n) return n.signum() == 0;
        return rank((String) item) == RELEASE_RANK;
    }

    private static int rank(String qualifier) {
        return QUALIFIER_RANKS.getOrDefault(qualifier, UNKNOWN_RANK);
    }

    /** Ordering without the raw-text tie break; {@code 1.0} and {@code 1.0.0} compare equal here. */
    public int comparePrecedence(Version o) {
        int n = Math.max(release.size(), o.release.size());
        for (int i = 0; i < n; i++) {
            int c = releaseComponent(i).compareTo(o.releaseComponent(i));
            if (c != 0) return c;
        }
        n = Math.max(tail.size(), o.tail.size());
        for (int i = 0; i < n; i++) {
            int c = compareItem(i < tail.size() ? tail.get(i) : null, i < o.tail.size() ? o.tail.get(i) : null);
            if (c != 0) return c;
        }
        return 0;
    }

    private static int compareItem(Object a, Object b) {
        if (a == null && b == null) return 0;
        if (a == null) return -compareItem(b, null);
        if (a instanceof BigInteger n) {
            if (b == null) return n.signum();
            if (b instanceof BigInteger m) return n.compareTo(m);
            return 1;
        }
        String q = (String) a;
        if (b == null) return Integer.compare(rank(q), RELEASE_RANK);
        if (b instanceof BigInteger) return -1;
        String r = (String) b;
        int c = Integer.compare(rank(q), rank(r));
        if (c != 0 || rank(q) != UNKNOWN_RANK) return c;
        return q.compareTo(r);
    }

    /** The i-th numeric release component, zero when absent. */
    public BigInteger releaseComponent(int i) {
        return i < release.size() ? release.get(i) : BigInteger.ZERO;
    }

    @Override
    public int compareTo(Version o) {
        int c = comparePrecedence(o);
        return c != 0 ? c : raw.compareTo(o.raw);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Version v && v.raw.equals(raw);
    }

    @Override
    public int hashCode() { return Objects.hash(raw); }

    @Override
    public String toString() { return raw; }
}
