package org.flutterjs.analyzer.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token.
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token, e.g. the segments of a string literal.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The file the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @param keyword A reserved word.
     * @return {@code true} if this token is that keyword.
     */
    public boolean isKeyword(String keyword) {
        return type == TokenType.KEYWORD && text.equals(keyword);
    }

    /**
     * @param name An identifier text.
     * @return {@code true} if this token is an identifier with exactly that text.
     */
    public boolean isIdentifier(String name) {
        return type == TokenType.IDENTIFIER && text.equals(name);
    }
}
