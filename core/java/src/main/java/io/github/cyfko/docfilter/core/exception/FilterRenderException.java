package io.github.cyfko.docfilter.core.exception;

/**
 * Exception thrown when a built filter cannot be rendered as JSON text, typically because it holds
 * a literal that has no JSON representation.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class FilterRenderException extends RuntimeException {

    public FilterRenderException(String message) {
        super(message);
    }

    /**
     * @param message explanation of the failure
     * @param cause   underlying serialization failure
     */
    public FilterRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
