package com.potatoregistry.version;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A version selector. Accepted forms:
 * <ul>
 *   <li>a plain version, {@code 1.4.2}: exact match on the stored string</li>
 *   <li>{@code latest}, {@code *} or {@code ,}: any version</li>
 *   <li>Maven intervals, {@code [1.0,2.0)}, {@code (,1.0]}, {@code [1.5]}; several intervals form a union</li>
 *   <li>comparator clauses that must all hold, {@code >=1.0,<2.0}, {@code ==1.2}, {@code !=1.3}</li>
 *   <li>release prefix wildcards, {@code 1.2.*} or {@code ==1.2.*} / {@code !=1.2.*}</li>
 * </ul>
 * Membership uses {@link Version#comparePrecedence}, so {@code [1.0]} also admits {@code 1.0.0}.
 */
public final class VersionRange {

    private interface Clause {
        boolean contains(Version v);
    }

    private record Bound(Version version, boolean inclusive) {}

    private record Interval(Bound lower, Bound upper) implements Clause {
        @Override
        public boolean contains(Version v) {
            if (lower != null) {
                int c = v.comparePrecedence(lower.version());
                if (c < 0 || (c == 0 && !lower.inclusive())) return false;
            }
            if (upper != null) {
                int c = v.comparePrecedence(upper.version());
                if (c > 0 || (c == 0 && !upper.inclusive())) return false;
            }
            return true;
        }
    }

    private record Comparison(String op, Version operand) implements Clause {
        @Override
        public boolean contains(Version v) {
            int c = v.comparePrecedence(operand);
            return switch (op) {
                case ">=" -> c >= 0;
                case ">" -> c > 0;
                case "<=" -> c <= 0;
                case "<" -> c < 0;
                case "==" -> c == 0;
                case "!=" -> c != 0;
                default -> throw new IllegalStateException("unknown operator " + op);
            };
        }
    }

    private record ReleasePrefix(List<BigInteger> prefix, boolean negated) implements Clause {
        @Override
        public boolean contains(Version v) {
            boolean match = true;
            for (int i = 0; i < prefix.size() && match; i++) {
                match = prefix.get(i).equals(v.releaseComponent(i));
            }
            return match != negated;
        }
    }

    private static final VersionRange ANY = new VersionRange("*", null, List.of(List.of()));

    private final String expression;
    private final Version exact;                  // non-null for plain versions
    private final List<List<Clause>> alternatives; // union of conjunctions

    private VersionRange(String expression, Version exact, List<List<Clause>> alternatives) {
        this.expression = expression;
        this.exact = exact;
        this.alternatives = alternatives;
    }

    public static VersionRange any() { return ANY; }

    public static VersionRange parse(String expression) {
        if (expression == null || expression.isBlank()) throw new IllegalArgumentException("version required");
        String s = expression.trim();
        String lower = s.toLowerCase(Locale.ROOT);
        if (lower.equals("latest") || s.equals("*") || s.equals(",")) {
            return ANY;
        }
        if (s.startsWith("[") || s.startsWith("(")) {
            return new VersionRange(s, null, parseIntervals(s));
        }
        if (s.indexOf('<') >= 0 || s.indexOf('>') >= 0 || s.indexOf('=') >= 0
                || s.indexOf('!') == 0 || s.indexOf(',') >= 0 || s.endsWith(".*")) {
            return new VersionRange(s, null, List.of(parseComparators(s)));
        }
        Version v = Version.parse(s);
        return new VersionRange(s, v, List.of(List.of(new Comparison("==", v))));
    }

    private static List<List<Clause>> parseIntervals(String s) {
        List<String> tokens = new ArrayList<>();
        boolean inRange = false;
        int start = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '[' || c == '(') {
                if (inRange) throw new IllegalArgumentException("nested interval in " + s);
                inRange = true;
                start = i;
            } else if (c == ']' || c == ')') {
                if (!inRange) throw new IllegalArgumentException("unbalanced interval in " + s);
                inRange = false;
                tokens.add(s.substring(start, i + 1));
            } else if (!inRange && c != ',' && !Character.isWhitespace(c)) {
                throw new IllegalArgumentException("unexpected '" + c + "' between intervals in " + s);
            }
        }
        if (inRange) throw new IllegalArgumentException("unterminated interval in " + s);

        List<List<Clause>> out = new ArrayList<>();
        for (String token : tokens) {
            boolean closedLeft = token.charAt(0) == '[';
            boolean closedRight = token.charAt(token.length() - 1) == ']';
            String body = token.substring(1, token.length() - 1).trim();
            int sep = body.indexOf(',');
            if (sep < 0) {
                if (!closedLeft || !closedRight) throw new IllegalArgumentException("single version must be pinned as [v]: " + token);
                Version pinned = Version.parse(body);
                out.add(List.of(new Interval(new Bound(pinned, true), new Bound(pinned, true))));
                continue;
            }
            String left = body.substring(0, sep).trim();
            String right = body.substring(sep + 1).trim();
            Bound lo = left.isEmpty() ? null : new Bound(Version.parse(left), closedLeft);
            Bound hi = right.isEmpty() ? null : new Bound(Version.parse(right), closedRight);
            if (lo != null && hi != null && lo.version().comparePrecedence(hi.version()) > 0) {
                throw new IllegalArgumentException("empty interval " + token);
            }
            out.add(List.of(new Interval(lo, hi)));
        }
        if (out.isEmpty()) throw new IllegalArgumentException("no interval in " + s);
        return out;
    }

    private static List<Clause> parseComparators(String s) {
        List<Clause> clauses = new ArrayList<>();
        for (String part : s.split(",", -1)) {
            String clause = part.trim();
            if (clause.isEmpty()) throw new IllegalArgumentException("empty clause in " + s);
            String op = "==";
            for (String candidate : new String[] {">=", "<=", "==", "!=", ">", "<", "="}) {
                if (clause.startsWith(candidate)) {
                    op = candidate.equals("=") ? "==" : candidate;
                    clause = clause.substring(candidate.length()).trim();
                    break;
                }
            }
            if (clause.endsWith(".*")) {
                if (!op.equals("==") && !op.equals("!=")) {
                    throw new IllegalArgumentException("wildcard only allowed with == or !=: " + part);
                }
                clauses.add(new ReleasePrefix(parsePrefix(clause.substring(0, clause.length() - 2)), op.equals("!=")));
            } else {
                clauses.add(new Comparison(op, Version.parse(clause)));
            }
        }
        return clauses;
    }

    private static List<BigInteger> parsePrefix(String prefix) {
        List<BigInteger> out = new ArrayList<>();
        for (String component : prefix.split("\\.")) {
            if (component.isEmpty() || !component.chars().allMatch(Character::isDigit)) {
                throw new IllegalArgumentException("wildcard prefix must be numeric: " + prefix);
            }
            out.add(new BigInteger(component));
        }
        return out;
    }

    /** A plain version string, to be matched exactly rather than by precedence. */
    public boolean isExact() { return exact != null; }

    public Version exactVersion() { return exact; }

    public boolean contains(Version v) {
        for (List<Clause> conjunction : alternatives) {
            if (conjunction.stream().allMatch(c -> c.contains(v))) return true;
        }
        return false;
    }

    /** Highest version of {@code available} inside this range, by the total order of {@link Version}. */
    public Optional<Version> selectFrom(Collection<Version> available) {
        Version best = null;
        for (Version v : available) {
            if ((best == null || v.compareTo(best) > 0) && contains(v)) {
                best = v;
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public String toString() { return expression; }
}
