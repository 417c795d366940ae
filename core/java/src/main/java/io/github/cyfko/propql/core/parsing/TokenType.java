package io.github.cyfko.propql.core.parsing;

import io.github.cyfko.propql.core.config.ReservedSymbol;

/**
 * Lexical categories of the formula grammar.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public enum TokenType {
    LEFT_PAREN,
    RIGHT_PAREN,
    AND,
    OR,
    NOT,
    FALSE,
    TRUE,
    IDENTIFIER,
    /**
     * Marks the exhausted token stream. Never produced by the tokenizer itself.
     */
    END;

    /**
     * Maps a single-character symbol to its token type.
     *
     * @param symbol the character to classify
     * @return the token type, or {@code null} if the character is not a reserved symbol
     */
    static TokenType ofSymbol(char symbol) {
        return switch (symbol) {
            case ReservedSymbol.LEFT_PAREN -> LEFT_PAREN;
            case ReservedSymbol.RIGHT_PAREN -> RIGHT_PAREN;
            case ReservedSymbol.AND -> AND;
            case ReservedSymbol.OR -> OR;
            case ReservedSymbol.NOT -> NOT;
            case ReservedSymbol.FALSE -> FALSE;
            case ReservedSymbol.TRUE -> TRUE;
            default -> null;
        };
    }
}
