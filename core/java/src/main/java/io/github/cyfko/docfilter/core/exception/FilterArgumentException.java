package io.github.cyfko.docfilter.core.exception;

/**
 * Exception thrown when a filter primitive receives an argument violating its contract.
 * <p>
 * Field names and comparison operators must be non-empty strings. The check happens before the
 * filter under construction is touched, so the builder is left exactly as it was.
 * </p>
 *
 * <p><strong>Examples:</strong></p>
 * <pre>{@code
 * new QueryBuilder().field("");
 * // → "Invalid field, should be a non-empty string: \"\""
 *
 * new QueryBuilder().field("age").is(null, 18);
 * // → "Invalid comparator, should be a non-empty string: null"
 * }</pre>
 *
 * <p>These are caller contract violations: they are never retried and the builder should be
 * discarded.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterArgumentException extends RuntimeException {

    private final transient Object offendingValue;

    /**
     * @param message        explanation of the violated contract
     * @param offendingValue the rejected argument, may be null
     */
    public FilterArgumentException(String message, Object offendingValue) {
        super(message);
        this.offendingValue = offendingValue;
    }

    /**
     * @param message        explanation of the violated contract
     * @param offendingValue the rejected argument, may be null
     * @param cause          the underlying failure
     */
    public FilterArgumentException(String message, Object offendingValue, Throwable cause) {
        super(message, cause);
        this.offendingValue = offendingValue;
    }

    /**
     * @return the argument that was rejected
     */
    public Object getOffendingValue() {
        return offendingValue;
    }
}
