package com.nayem.tether.predicate;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ivy-style version constraint over dotted numeric versions.
 * <p>
 * Supported forms:
 * </p>
 * <ul>
 * <li>exact: {@code 1.2.3}</li>
 * <li>prefix: {@code 1.2+}, {@code 1.2.+}, or {@code +} for any version</li>
 * <li>range: {@code [1.0,2.0]}, {@code [1.0,2.0)}, {@code (1.0,2.0]},
 * {@code (,2.0]}, {@code [1.0,)}; {@code ]} and {@code [} are accepted as the
 * exclusive forms of {@code [} and {@code ]}</li>
 * </ul>
 * Missing trailing components compare as zero, so {@code 1.0} equals
 * {@code 1.0.0}. Anything that is not a dotted list of non-negative integers is
 * malformed and never matches.
 */
public final class VersionConstraint {

    private enum Type {
        EXACT,
        PREFIX,
        RANGE
    }

    private final String expression;
    private final Type type;
    private final long[] exact;
    private final long[] lower;
    private final boolean lowerInclusive;
    private final long[] upper;
    private final boolean upperInclusive;

    private VersionConstraint(String expression, Type type, long[] exact, long[] lower, boolean lowerInclusive,
            long[] upper, boolean upperInclusive) {
        this.expression = expression;
        this.type = type;
        this.exact = exact;
        this.lower = lower;
        this.lowerInclusive = lowerInclusive;
        this.upper = upper;
        this.upperInclusive = upperInclusive;
    }

    /**
     * @throws IllegalArgumentException if the expression is not a valid constraint
     */
    public static VersionConstraint parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("version constraint must not be blank");
        }
        String trimmed = expression.trim();
        char first = trimmed.charAt(0);

        if (first == '[' || first == '(' || first == ']') {
            return parseRange(trimmed);
        }

        if (trimmed.endsWith("+")) {
            String prefix = trimmed.substring(0, trimmed.length() - 1);
            if (prefix.endsWith(".")) {
                prefix = prefix.substring(0, prefix.length() - 1);
            }
            long[] components = prefix.isEmpty() ? new long[0] : require(prefix, trimmed);
            return new VersionConstraint(trimmed, Type.PREFIX, components, null, false, null, false);
        }

        return new VersionConstraint(trimmed, Type.EXACT, require(trimmed, trimmed), null, false, null, false);
    }

    private static VersionConstraint parseRange(String trimmed) {
        if (trimmed.length() < 3) {
            throw new IllegalArgumentException("invalid version range: " + trimmed);
        }
        char open = trimmed.charAt(0);
        char close = trimmed.charAt(trimmed.length() - 1);
        if (close != ']' && close != ')' && close != '[') {
            throw new IllegalArgumentException("invalid version range: " + trimmed);
        }

        String[] bounds = trimmed.substring(1, trimmed.length() - 1).split(",", -1);
        if (bounds.length != 2) {
            throw new IllegalArgumentException("version range needs exactly two bounds: " + trimmed);
        }

        String lowerText = bounds[0].trim();
        String upperText = bounds[1].trim();
        if (lowerText.isEmpty() && upperText.isEmpty()) {
            throw new IllegalArgumentException("version range needs at least one bound: " + trimmed);
        }

        long[] lower = lowerText.isEmpty() ? null : require(lowerText, trimmed);
        long[] upper = upperText.isEmpty() ? null : require(upperText, trimmed);
        if (lower != null && upper != null && compare(lower, upper) > 0) {
            throw new IllegalArgumentException("version range lower bound exceeds upper bound: " + trimmed);
        }
        return new VersionConstraint(trimmed, Type.RANGE, null, lower, open == '[', upper, close == ']');
    }

    private static long[] require(String version, String expression) {
        return parseVersion(version)
                .orElseThrow(() -> new IllegalArgumentException("invalid version in constraint: " + expression));
    }

    /**
     * Parses a dotted numeric version, or returns empty if it is malformed.
     */
    public static Optional<long[]> parseVersion(String version) {
        if (version == null) {
            return Optional.empty();
        }
        String trimmed = version.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        String[] parts = trimmed.split("\\.", -1);
        List<Long> components = new ArrayList<>(parts.length);
        for (String part : parts) {
            if (part.isEmpty()) {
                return Optional.empty();
            }
            for (int i = 0; i < part.length(); i++) {
                char c = part.charAt(i);
                if (c < '0' || c > '9') {
                    return Optional.empty();
                }
            }
            try {
                components.add(Long.parseLong(part));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.of(components.stream().mapToLong(Long::longValue).toArray());
    }

    public boolean matches(String version) {
        Optional<long[]> parsed = parseVersion(version);
        if (parsed.isEmpty()) {
            return false;
        }
        long[] candidate = parsed.get();
        return switch (type) {
            case EXACT -> compare(candidate, exact) == 0;
            case PREFIX -> startsWith(candidate, exact);
            case RANGE -> withinLower(candidate) && withinUpper(candidate);
        };
    }

    private boolean withinLower(long[] candidate) {
        if (lower == null) {
            return true;
        }
        int cmp = compare(candidate, lower);
        return lowerInclusive ? cmp >= 0 : cmp > 0;
    }

    private boolean withinUpper(long[] candidate) {
        if (upper == null) {
            return true;
        }
        int cmp = compare(candidate, upper);
        return upperInclusive ? cmp <= 0 : cmp < 0;
    }

    private static boolean startsWith(long[] candidate, long[] prefix) {
        for (int i = 0; i < prefix.length; i++) {
            long component = i < candidate.length ? candidate[i] : 0;
            if (component != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    static int compare(long[] a, long[] b) {
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            long left = i < a.length ? a[i] : 0;
            long right = i < b.length ? b[i] : 0;
            if (left != right) {
                return Long.compare(left, right);
            }
        }
        return 0;
    }

    /**
     * The constraint as it was written, trimmed.
     */
    public String expression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VersionConstraint other)) {
            return false;
        }
        return expression.equals(other.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression);
    }

    @Override
    public String toString() {
        return expression;
    }
}
