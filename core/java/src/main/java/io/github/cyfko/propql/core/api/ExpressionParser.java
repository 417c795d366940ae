package io.github.cyfko.propql.core.api;

import io.github.cyfko.propql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.propql.core.model.Expression;

/**
 * Parser turning formula text into {@link Expression} trees.
 *
 * <h2>Grammar</h2>
 * <pre>
 * input      := body                                  (the whole input is an implicit group)
 * expression := '0' | '1' | name | '~' expression | '(' body ')'
 * body       := expression (OP expression)*           (OP is '&amp;' or '|', the same one throughout)
 * name       := letter+
 * </pre>
 * <table border="1">
 * <caption>Symbol Reference</caption>
 * <thead>
 * <tr><th>Symbol</th><th>Meaning</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>0 / 1</td><td>false / true</td><td>a &amp; 1</td></tr>
 * <tr><td>~</td><td>negation of the next operand only</td><td>~a, ~(a|b)</td></tr>
 * <tr><td>&amp;</td><td>conjunction</td><td>a &amp; b &amp; c</td></tr>
 * <tr><td>|</td><td>disjunction</td><td>a | b | c</td></tr>
 * <tr><td>( )</td><td>group, required to change connective</td><td>a &amp; (b | c)</td></tr>
 * </tbody>
 * </table>
 * <p>
 * There is no precedence between {@code &} and {@code |}: a group uses one connective only, so
 * {@code a&b|c} is rejected and must be written {@code (a&b)|c} or {@code a&(b|c)}.
 * Whitespace (space, tab, newline) separates tokens and is otherwise ignored.
 * </p>
 *
 * <h3>Invalid Expression Examples</h3>
 * <pre>{@code
 * parser.parse("(a&b|c)");   // operator disagreement
 * parser.parse("(a~b)");     // '~' is not a connective
 * parser.parse("(a&b)c");    // trailing input
 * parser.parse("(a&b))");    // unbalanced ')'
 * parser.parse("!");         // invalid symbol
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see ExpressionSyntaxException
 */
public interface ExpressionParser {

    /**
     * Parses formula text into an expression tree.
     * <p>
     * Connectives are built through the canonical factories of {@link Expression}, so the result
     * never contains an {@code And} or {@code Or} with fewer than two operands. No simplification
     * is performed: constants and nested groups of the same connective are kept as written.
     * </p>
     *
     * @param text the formula text, must not be null or blank
     * @return the parsed expression
     * @throws ExpressionSyntaxException if the text does not conform to the grammar
     */
    Expression parse(String text) throws ExpressionSyntaxException;
}
