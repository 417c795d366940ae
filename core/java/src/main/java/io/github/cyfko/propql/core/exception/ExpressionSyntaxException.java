package io.github.cyfko.propql.core.exception;

import io.github.cyfko.propql.core.api.ExpressionParser;
import io.github.cyfko.propql.core.impl.BasicExpressionParser;
import io.github.cyfko.propql.core.parsing.ExpressionTokenizer;

/**
 * Exception thrown when a formula text cannot be turned into an expression tree.
 * <p>
 * Parsing always fails closed: when this exception is raised no partial tree is returned.
 * The message is meant to be shown to the author of the formula and, where it makes sense,
 * names the offending symbol and its character position.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Invalid symbol:</strong> a character outside the grammar, e.g. {@code !}</li>
 *   <li><strong>Operator disagreement:</strong> {@code &} and {@code |} mixed in one group</li>
 *   <li><strong>Unbalanced parentheses:</strong> a missing or surplus {@code )}</li>
 *   <li><strong>Trailing input:</strong> tokens left after a complete expression</li>
 *   <li><strong>Premature end:</strong> input ends while an operand is still expected</li>
 *   <li><strong>Policy limits:</strong> input too long or nested too deeply</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("(a&b|c)");
 * // → "Operator disagreement at position 4: group uses '&' but found '|'"
 *
 * parser.parse("!");
 * // → "Invalid symbol '!' at position 0"
 *
 * parser.parse("(a&b))");
 * // → "Expected end of input but found ')' at position 5"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionParser
 * @see BasicExpressionParser
 * @see ExpressionTokenizer
 */
public class ExpressionSyntaxException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the syntax error, including position information when available
     */
    public ExpressionSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     * <p>
     * Used when a syntax error surfaces as a lower level failure, e.g. a variable name rejected
     * by the model while the parser builds the tree.
     * </p>
     *
     * @param message the message describing the syntax error
     * @param cause   the original cause of this exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
