package medguard.core.model.permission;

import java.util.List;

import medguard.core.exception.ValidationException;

/**
 * A parsed permission pattern of the form {@code domain:resource:action}.
 *
 * <p>Patterns have one to three colon-separated segments. Any segment may be the
 * wildcard {@code *}. Patterns with fewer than three segments are implicitly
 * extended on the right with wildcards, so {@code user:manage} is equivalent to
 * {@code user:manage:*}. The bare pattern {@code *} is the superuser pattern and
 * matches every request.
 *
 * <p>Segments are case-sensitive and may not be empty or contain whitespace.
 *
 * <p>Equality and hashing use the padded segments only: {@code user:manage}
 * and {@code user:manage:*} are equal, as are {@code *} and {@code *:*:*}.
 *
 * @param value    the pattern exactly as supplied
 * @param segments the three segments after right-padding with wildcards
 */
public record Permission(String value, List<String> segments) {

    /** The wildcard token. */
    public static final String WILDCARD = "*";

    /** Number of segments every pattern is padded to. */
    public static final int DEPTH = 3;

    private static final String SEPARATOR = ":";

    public Permission {
        if (segments == null || segments.size() != DEPTH) {
            throw new ValidationException("Permission must carry " + DEPTH + " segments");
        }
        segments = List.copyOf(segments);
        if (!segmentsOf(value).equals(segments)) {
            throw new ValidationException(
                    "Permission segments " + segments + " do not match pattern '" + value + "'");
        }
    }

    /**
     * Parse a permission pattern.
     *
     * @param pattern the pattern string
     * @return the parsed permission
     * @throws ValidationException if the pattern is null, empty, has more than three
     *                             segments, or has an empty or blank segment
     */
    public static Permission parse(String pattern) {
        return new Permission(pattern, segmentsOf(pattern));
    }

    /**
     * Check whether a string is a well-formed pattern without throwing.
     *
     * @param pattern the pattern string
     * @return true if {@link #parse(String)} would accept it
     */
    public static boolean isValid(String pattern) {
        try {
            parse(pattern);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Whether this pattern matches everything: {@code *} or an equivalent spelling.
     *
     * @return true if every segment is the wildcard
     */
    public boolean isSuperuser() {
        for (var segment : segments) {
            if (!WILDCARD.equals(segment)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Return the segment at a position after padding.
     *
     * @param index 0 for domain, 1 for resource, 2 for action
     * @return the segment
     */
    public String segment(int index) {
        return segments.get(index);
    }

    public String domain() {
        return segments.get(0);
    }

    public String resource() {
        return segments.get(1);
    }

    public String action() {
        return segments.get(2);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        return other instanceof Permission permission && segments.equals(permission.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

    private static List<String> segmentsOf(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new ValidationException("Permission pattern cannot be null or empty");
        }

        final var parts = pattern.split(SEPARATOR, -1);
        if (parts.length > DEPTH) {
            throw new ValidationException(
                    "Permission pattern '" + pattern + "' has more than " + DEPTH + " segments");
        }

        final var padded = new String[DEPTH];
        for (var i = 0; i < DEPTH; i++) {
            if (i < parts.length) {
                final var segment = parts[i];
                if (segment.isEmpty() || segment.isBlank() || containsWhitespace(segment)) {
                    throw new ValidationException("Permission pattern '" + pattern + "' has an empty segment");
                }
                padded[i] = segment;
            } else {
                padded[i] = WILDCARD;
            }
        }
        return List.of(padded);
    }

    private static boolean containsWhitespace(String segment) {
        for (var i = 0; i < segment.length(); i++) {
            if (Character.isWhitespace(segment.charAt(i))) {
                return true;
            }
        }
        return false;
    }
}
