package io.github.cyfko.propql.core.parsing;

import io.github.cyfko.propql.core.config.ReservedSymbol;
import io.github.cyfko.propql.core.exception.ExpressionSyntaxException;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Lazy, single-pass tokenizer for the formula grammar.
 * <p>
 * Tokens are produced on demand, left to right, without backtracking:
 * </p>
 * <ul>
 *   <li>{@code ( ) & | ~ 0 1}: one token per character</li>
 *   <li>a maximal run of alphabetic characters: one {@link TokenType#IDENTIFIER} token</li>
 *   <li>space, tab and newline: separators only, they end a name but yield nothing</li>
 *   <li>anything else: {@link ExpressionSyntaxException}, raised when the tokenizer reaches it</li>
 * </ul>
 * <p>
 * The tokenizer knows nothing about nesting; balancing parentheses is the parser's job.
 * </p>
 *
 * <pre>{@code
 * ExpressionTokenizer tokens = new ExpressionTokenizer("~(ab | c)");
 * // NOT '~'@0, LEFT_PAREN '('@1, IDENTIFIER 'ab'@2, OR '|'@5, IDENTIFIER 'c'@7, RIGHT_PAREN ')'@8
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ExpressionTokenizer implements Iterator<Token> {

    private final CharSequence input;
    private int cursor;
    private Token lookahead;

    public ExpressionTokenizer(CharSequence input) {
        this.input = Objects.requireNonNull(input, "Input is required");
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null) {
            lookahead = scan();
        }
        return lookahead != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens after position " + cursor);
        }
        Token token = lookahead;
        lookahead = null;
        return token;
    }

    /**
     * @return the offset just past the last character consumed so far
     */
    public int position() {
        return cursor;
    }

    private Token scan() {
        final int length = input.length();

        while (cursor < length) {
            char c = input.charAt(cursor);

            if (ReservedSymbol.isSeparator(c)) {
                cursor++;
                continue;
            }

            if (ReservedSymbol.isNameCharacter(c)) {
                int start = cursor;
                while (cursor < length && ReservedSymbol.isNameCharacter(input.charAt(cursor))) {
                    cursor++;
                }
                return new Token(TokenType.IDENTIFIER, input.subSequence(start, cursor).toString(), start);
            }

            TokenType type = TokenType.ofSymbol(c);
            if (type == null) {
                throw new ExpressionSyntaxException(String.format("Invalid symbol '%c' at position %d", c, cursor));
            }
            return new Token(type, String.valueOf(c), cursor++);
        }

        return null;
    }
}
