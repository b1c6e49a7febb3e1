package org.parenc.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The text of the token. For strings this is the content between the quotes.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {

    /**
     * @return {@code true} if this token is the opening parenthesis.
     */
    public boolean isOpenParen() {
        return type == TokenType.PAREN && "(".equals(text);
    }

    /**
     * @return {@code true} if this token is the closing parenthesis.
     */
    public boolean isCloseParen() {
        return type == TokenType.PAREN && ")".equals(text);
    }
}
