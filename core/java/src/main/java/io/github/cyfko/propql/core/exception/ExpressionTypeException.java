package io.github.cyfko.propql.core.exception;

/**
 * Exception thrown when a value that is not one of the recognized expression variants
 * is handed to an operation that renders expressions.
 * <p>
 * This signals a contract violation by the caller rather than bad input data.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class ExpressionTypeException extends IllegalArgumentException {

    /**
     * @param message the message naming the unexpected type
     */
    public ExpressionTypeException(String message) {
        super(message);
    }
}
