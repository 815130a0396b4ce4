package io.github.cyfko.docfilter.core.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A literal leaf of a filter tree: string, number, boolean, {@code null}, date, regular expression
 * or any other driver-supported object.
 * <p>
 * Equality follows the document store rather than Java where the two differ:
 * </p>
 * <ul>
 *   <li>two {@link Pattern}s are equal when both their source and their flags are equal</li>
 *   <li>integral numbers ({@code Byte}, {@code Short}, {@code Integer}, {@code Long}) are equal
 *       when their {@code long} values are, so {@code 18} and {@code 18L} describe one operand</li>
 * </ul>
 *
 * @param value the wrapped literal, may be {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record FilterValue(Object value) implements FilterNode {

    private static final FilterValue NULL = new FilterValue(null);

    /**
     * @param value the literal to wrap
     * @return a literal node
     */
    public static FilterValue of(Object value) {
        return value == null ? NULL : new FilterValue(value);
    }

    @Override
    public Object toRaw() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FilterValue other)) return false;
        if (value instanceof Pattern p1 && other.value instanceof Pattern p2) {
            return p1.pattern().equals(p2.pattern()) && p1.flags() == p2.flags();
        }
        if (isIntegral(value) && isIntegral(other.value)) {
            return ((Number) value).longValue() == ((Number) other.value).longValue();
        }
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        if (value instanceof Pattern p) {
            return 31 * p.pattern().hashCode() + p.flags();
        }
        if (isIntegral(value)) {
            return Long.hashCode(((Number) value).longValue());
        }
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        if (value instanceof Pattern p) {
            return "/" + p.pattern() + "/" + options(p.flags());
        }
        return value instanceof String s ? "\"" + s + "\"" : String.valueOf(value);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte;
    }

    /**
     * Regex options in the document store's notation, in alphabetical order. Flags without an
     * equivalent are left out.
     */
    static String options(int flags) {
        StringBuilder options = new StringBuilder(4);
        if ((flags & Pattern.CASE_INSENSITIVE) != 0) options.append('i');
        if ((flags & Pattern.MULTILINE) != 0) options.append('m');
        if ((flags & Pattern.DOTALL) != 0) options.append('s');
        if ((flags & Pattern.COMMENTS) != 0) options.append('x');
        return options.toString();
    }
}
