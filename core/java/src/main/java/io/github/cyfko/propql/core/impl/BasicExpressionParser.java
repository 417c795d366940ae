package io.github.cyfko.propql.core.impl;

import io.github.cyfko.propql.core.api.ExpressionParser;
import io.github.cyfko.propql.core.config.ParserPolicy;
import io.github.cyfko.propql.core.exception.ExpressionSyntaxException;
import io.github.cyfko.propql.core.model.Constant;
import io.github.cyfko.propql.core.model.Expression;
import io.github.cyfko.propql.core.parsing.ExpressionTokenizer;
import io.github.cyfko.propql.core.parsing.Token;
import io.github.cyfko.propql.core.parsing.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Recursive-descent implementation of {@link ExpressionParser}.
 * <p>
 * The parser pulls tokens lazily from an {@link ExpressionTokenizer} with a single token of
 * lookahead. The whole input is parsed as an implicit group closed by the end of input, which is
 * why a bare {@code a&b} needs no parentheses while any nested change of connective does.
 * </p>
 *
 * <h2>Limits</h2>
 * <p>
 * The {@link ParserPolicy} bounds the input length and the nesting depth (groups and negations,
 * the implicit outer group counting as one level). Both are checked before the offending input
 * is consumed any further.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * Expression e = parser.parse("a & (b | ~c)");
 *
 * ExpressionParser strictParser = new BasicExpressionParser(ParserPolicy.strict());
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final ParserPolicy parserPolicy;

    /**
     * Default constructor using {@link ParserPolicy#unbounded()}.
     */
    public BasicExpressionParser() {
        this(ParserPolicy.unbounded());
    }

    /**
     * @param parserPolicy the limits to enforce
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicExpressionParser(ParserPolicy parserPolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.parserPolicy = parserPolicy;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    @Override
    public Expression parse(String text) throws ExpressionSyntaxException {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException("Expression cannot be null or empty");
        }

        if (text.length() > parserPolicy.maxExpressionLength()) {
            log.warning(() -> String.format(
                    "Rejected expression of %d characters (policy %s)", text.length(), parserPolicy.policyName()
            ));
            throw new ExpressionSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    text.length(), parserPolicy.maxExpressionLength(), parserPolicy.policyName()
            ));
        }

        Expression expression = new Run(text).parseGroup(null, 1);

        log.fine(() -> String.format("Parsed expression of %d characters", text.length()));
        return expression;
    }

    /**
     * State of a single parse: the token source and its one-token lookahead.
     */
    private final class Run {
        private final ExpressionTokenizer tokenizer;

        Run(String text) {
            this.tokenizer = new ExpressionTokenizer(text);
        }

        private Token nextToken() {
            return tokenizer.hasNext() ? tokenizer.next() : Token.end(tokenizer.position());
        }

        /**
         * expression := '0' | '1' | name | '~' expression | '(' body ')'
         */
        Expression parseExpression(int depth) {
            Token token = nextToken();
            return switch (token.type()) {
                case FALSE -> Constant.FALSE;
                case TRUE -> Constant.TRUE;
                case IDENTIFIER -> Expression.variable(token.text());
                case NOT -> Expression.not(parseExpression(enter(token, depth)));
                case LEFT_PAREN -> parseGroup(token, enter(token, depth));
                case END -> throw new ExpressionSyntaxException(
                        "Unexpected end of input at position " + token.position() + ": an operand is missing");
                default -> throw new ExpressionSyntaxException(String.format(
                        "Unexpected token %s at position %d", token.describe(), token.position()));
            };
        }

        /**
         * Parses the operands of a group up to its closing token.
         *
         * @param opener the opening parenthesis, or {@code null} for the implicit outer group
         * @param depth  nesting depth of the operands
         */
        Expression parseGroup(Token opener, int depth) {
            final boolean outermost = opener == null;
            final TokenType closing = outermost ? TokenType.END : TokenType.RIGHT_PAREN;

            Token operator = null;
            List<Expression> operands = new ArrayList<>();

            while (true) {
                operands.add(parseExpression(depth));
                Token token = nextToken();

                if (token.type() == closing) {
                    break;
                }

                if (token.type() == TokenType.AND || token.type() == TokenType.OR) {
                    if (operator != null && operator.type() != token.type()) {
                        throw new ExpressionSyntaxException(String.format(
                                "Operator disagreement at position %d: group uses %s but found %s",
                                token.position(), operator.describe(), token.describe()));
                    }
                    operator = token;
                } else if (outermost) {
                    throw new ExpressionSyntaxException(String.format(
                            "Expected end of input but found %s at position %d", token.describe(), token.position()));
                } else if (token.type() == TokenType.END) {
                    throw new ExpressionSyntaxException(String.format(
                            "Unexpected end of input at position %d: '(' at position %d is never closed",
                            token.position(), opener.position()));
                } else {
                    throw new ExpressionSyntaxException(String.format(
                            "Invalid operator %s at position %d: expected '&', '|' or ')'",
                            token.describe(), token.position()));
                }
            }

            if (operator == null) {
                return operands.get(0);
            }
            return operator.type() == TokenType.AND ? Expression.and(operands) : Expression.or(operands);
        }

        private int enter(Token token, int depth) {
            int nested = depth + 1;
            if (nested > parserPolicy.maxNestingDepth()) {
                log.warning(() -> String.format(
                        "Rejected expression nested deeper than %d (policy %s)",
                        parserPolicy.maxNestingDepth(), parserPolicy.policyName()
                ));
                throw new ExpressionSyntaxException(String.format(
                        "Expression nested too deeply at position %d (max depth: %d). Policy applied: %s",
                        token.position(), parserPolicy.maxNestingDepth(), parserPolicy.policyName()
                ));
            }
            return nested;
        }
    }
}
