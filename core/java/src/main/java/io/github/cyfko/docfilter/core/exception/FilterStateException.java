package io.github.cyfko.docfilter.core.exception;

/**
 * Exception thrown when a builder operation is invoked in a state that does not allow it.
 * <p>
 * Continuation calls resume the sub-builder created by their initiating call, and fail when that
 * call never happened:
 * </p>
 * <pre>{@code
 * new QueryBuilder().andField();
 * // → "Illegal andField() call: should be called only after field() was called"
 *
 * new QueryBuilder().andSearch();
 * // → "Illegal andSearch() call: should be called only after search() was called"
 * }</pre>
 * <p>This signals a programming error, not a data error.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterStateException extends RuntimeException {

    public FilterStateException(String message) {
        super(message);
    }

    public FilterStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
