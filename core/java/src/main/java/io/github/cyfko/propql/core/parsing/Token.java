package io.github.cyfko.propql.core.parsing;

/**
 * A lexical token and where it starts in the input.
 *
 * @param type     the token category
 * @param text     the characters of the token, empty for {@link TokenType#END}
 * @param position 0-based offset of the first character in the input
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Token(TokenType type, String text, int position) {

    /**
     * @param position offset at which the input ran out
     * @return the end-of-input marker
     */
    public static Token end(int position) {
        return new Token(TokenType.END, "", position);
    }

    /**
     * @return a human readable description for error messages
     */
    public String describe() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
