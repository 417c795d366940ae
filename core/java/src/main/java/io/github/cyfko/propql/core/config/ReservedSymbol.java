package io.github.cyfko.propql.core.config;

/**
 * Reserved symbols of the formula grammar.
 * <p>
 * The parser, the tokenizer and the formatter all read their vocabulary from here so that
 * the text they accept and the text they produce can never drift apart.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public final class ReservedSymbol {

    /**
     * Symbol representing the boolean constant TRUE.
     */
    public static final char TRUE = '1';

    /**
     * Symbol representing the boolean constant FALSE.
     */
    public static final char FALSE = '0';

    public static final char AND = '&';
    public static final char OR = '|';
    public static final char NOT = '~';
    public static final char LEFT_PAREN = '(';
    public static final char RIGHT_PAREN = ')';

    private ReservedSymbol() {}

    /**
     * Tells whether the character only separates tokens.
     * <p>
     * Only space, tab and newline qualify; any other control character is an invalid symbol.
     * </p>
     *
     * @param c the character to test
     * @return {@code true} for space, tab and newline
     */
    public static boolean isSeparator(char c) {
        return c == ' ' || c == '\t' || c == '\n';
    }

    /**
     * Tells whether the character may appear in a variable name.
     *
     * @param c the character to test
     * @return {@code true} if the character is alphabetic
     */
    public static boolean isNameCharacter(char c) {
        return Character.isLetter(c);
    }
}
