package org.flutterjs.analyzer.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * Reserved words share the single {@link #KEYWORD} type and are told apart by their text;
 * built-in identifiers such as {@code get}, {@code show} or {@code async} are plain identifiers.
 */
public enum TokenType {
    // Grouping and punctuation.
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET,
    COMMA, SEMICOLON, COLON, AT, HASH,
    /** '.' member access. */
    DOT,
    /** '..' cascade. */
    DOT_DOT,
    /** '...' spread. */
    ELLIPSIS,
    /** '...?' null-aware spread. */
    ELLIPSIS_QUESTION,
    QUESTION,
    /** '?.' null-aware member access. */
    QUESTION_DOT,
    /** '?..' null-aware cascade. */
    QUESTION_DOT_DOT,
    /** '??' if-null. */
    QUESTION_QUESTION,
    /** '=>' arrow body. */
    ARROW,

    // Operators.
    PLUS, MINUS, STAR, SLASH, TILDE_SLASH, PERCENT, PLUS_PLUS, MINUS_MINUS,
    BANG, TILDE, AMP, PIPE, CARET, LESS_LESS,
    AMP_AMP, PIPE_PIPE,
    EQUAL, EQUAL_EQUAL, BANG_EQUAL,
    LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,

    // Compound assignment.
    PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL, TILDE_SLASH_EQUAL, PERCENT_EQUAL,
    AMP_EQUAL, PIPE_EQUAL, CARET_EQUAL, LESS_LESS_EQUAL, QUESTION_QUESTION_EQUAL,

    // Literals.
    /** An identifier, including built-in identifiers like {@code get} or {@code required}. */
    IDENTIFIER,
    /** A reserved word such as {@code class} or {@code return}. */
    KEYWORD,
    /** An integer or floating point literal; the text is the value. */
    NUMBER,
    /** A string literal; the value is a list of {@link StringSegment}s. */
    STRING,

    /** Represents the end of the source file. */
    END_OF_FILE
}
