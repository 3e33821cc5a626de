package org.flutterjs.analyzer.frontend.lexer;

import java.util.List;

/**
 * One segment of a string literal: either literal text (escapes already decoded) or the tokens
 * of an interpolated expression ({@code $name} or {@code ${expression}}).
 *
 * @param text   The literal text; {@code null} for interpolations.
 * @param tokens The interpolated expression's tokens, terminated by END_OF_FILE; {@code null} for text.
 */
public record StringSegment(String text, List<Token> tokens) {

    public static StringSegment text(String text) {
        return new StringSegment(text, null);
    }

    public static StringSegment interpolation(List<Token> tokens) {
        return new StringSegment(null, List.copyOf(tokens));
    }

    public boolean isInterpolation() {
        return tokens != null;
    }
}
