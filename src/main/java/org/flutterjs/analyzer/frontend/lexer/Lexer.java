package org.flutterjs.analyzer.frontend.lexer;

import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts Dart source text into a sequence
 * of tokens.
 * <p>
 * String literals are scanned into {@link StringSegment}s; interpolated expressions are
 * tokenized recursively so the parser can parse them like any other expression.
 */
public class Lexer {

    private static final Set<String> KEYWORDS = Set.of(
            "assert", "break", "case", "catch", "class", "const", "continue", "default", "do", "else",
            "enum", "extends", "false", "final", "finally", "for", "if", "in", "is", "new", "null",
            "rethrow", "return", "super", "switch", "this", "throw", "true", "try", "var", "void",
            "while", "with");

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int lineStart = 0;
    private int tokenLine = 1;
    private int tokenColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, terminated by {@link TokenType#END_OF_FILE}.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            markStart();
            scanToken();
        }
        markStart();
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, tokenLine, tokenColumn, logicalFileName));
        return tokens;
    }

    private void markStart() {
        start = current;
        tokenLine = line;
        tokenColumn = current - lineStart + 1;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case ':': addToken(TokenType.COLON); break;
            case '@': addToken(TokenType.AT); break;
            case '#': addToken(TokenType.HASH); break;
            case '.':
                if (match('.')) {
                    if (match('.')) {
                        addToken(match('?') ? TokenType.ELLIPSIS_QUESTION : TokenType.ELLIPSIS);
                    } else {
                        addToken(TokenType.DOT_DOT);
                    }
                } else if (isDigit(peek())) {
                    number();
                } else {
                    addToken(TokenType.DOT);
                }
                break;
            case '?':
                if (match('.')) {
                    addToken(match('.') ? TokenType.QUESTION_DOT_DOT : TokenType.QUESTION_DOT);
                } else if (match('?')) {
                    addToken(match('=') ? TokenType.QUESTION_QUESTION_EQUAL : TokenType.QUESTION_QUESTION);
                } else {
                    addToken(TokenType.QUESTION);
                }
                break;
            case '+':
                addToken(match('+') ? TokenType.PLUS_PLUS : match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
                break;
            case '-':
                addToken(match('-') ? TokenType.MINUS_MINUS : match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                break;
            case '*': addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR); break;
            case '%': addToken(match('=') ? TokenType.PERCENT_EQUAL : TokenType.PERCENT); break;
            case '^': addToken(match('=') ? TokenType.CARET_EQUAL : TokenType.CARET); break;
            case '!': addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG); break;
            case '=':
                addToken(match('=') ? TokenType.EQUAL_EQUAL : match('>') ? TokenType.ARROW : TokenType.EQUAL);
                break;
            case '<':
                if (match('<')) {
                    addToken(match('=') ? TokenType.LESS_LESS_EQUAL : TokenType.LESS_LESS);
                } else {
                    addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
                }
                break;
            // '>>' is left to the parser so nested generics like List<List<int>> close cleanly.
            case '>': addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER); break;
            case '&':
                addToken(match('&') ? TokenType.AMP_AMP : match('=') ? TokenType.AMP_EQUAL : TokenType.AMP);
                break;
            case '|':
                addToken(match('|') ? TokenType.PIPE_PIPE : match('=') ? TokenType.PIPE_EQUAL : TokenType.PIPE);
                break;
            case '~':
                if (match('/')) {
                    addToken(match('=') ? TokenType.TILDE_SLASH_EQUAL : TokenType.TILDE_SLASH);
                } else {
                    addToken(TokenType.TILDE);
                }
                break;
            case '/':
                if (match('/')) {
                    // A comment goes until the end of the line.
                    while (peek() != '\n' && !isAtEnd()) advance();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '\'', '"':
                string(c, false);
                break;
            // Ignore whitespace
            case ' ', '\r', '\t', '\n', '\f':
                break;
            default:
                if (c == 'r' && (peek() == '\'' || peek() == '"')) {
                    string(advance(), true);
                } else if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: " + c);
                }
                break;
        }
    }

    private void blockComment() {
        int depth = 1;
        while (!isAtEnd() && depth > 0) {
            if (peek() == '/' && peekNext() == '*') {
                advance();
                advance();
                depth++;
            } else if (peek() == '*' && peekNext() == '/') {
                advance();
                advance();
                depth--;
            } else {
                advance();
            }
        }
        if (depth > 0) {
            error("Unterminated block comment.");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        addToken(KEYWORDS.contains(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER);
    }

    private void number() {
        if (previous() == '0' && (peek() == 'x' || peek() == 'X')) {
            advance();
            while (isHexDigit(peek())) advance();
        } else {
            while (isDigit(peek())) advance();
            if (peek() == '.' && isDigit(peekNext())) {
                advance();
                while (isDigit(peek())) advance();
            }
            if ((peek() == 'e' || peek() == 'E')
                    && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
                advance();
                if (peek() == '+' || peek() == '-') advance();
                while (isDigit(peek())) advance();
            }
        }
        String text = source.substring(start, current);
        addToken(TokenType.NUMBER, text);
    }

    private void string(char quote, boolean raw) {
        boolean triple = peek() == quote && peekNext() == quote;
        if (triple) {
            advance();
            advance();
            // A newline directly after the opening quotes is not part of the value.
            if (peek() == '\r' && peekNext() == '\n') advance();
            if (peek() == '\n') advance();
        }
        List<StringSegment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                error("Unterminated string.");
                return;
            }
            char c = peek();
            if (triple) {
                if (c == quote && peekNext() == quote && peekAt(2) == quote) {
                    advance();
                    advance();
                    advance();
                    break;
                }
            } else {
                if (c == quote) {
                    advance();
                    break;
                }
                if (c == '\n') {
                    error("Unterminated string.");
                    return;
                }
            }
            if (!raw && c == '\\') {
                advance();
                text.append(escape());
            } else if (!raw && c == '$' && peekNext() == '{') {
                advance();
                advance();
                flush(text, segments);
                segments.add(StringSegment.interpolation(scanInterpolation()));
            } else if (!raw && c == '$' && isAlpha(peekNext()) && peekNext() != '$') {
                advance();
                flush(text, segments);
                segments.add(StringSegment.interpolation(scanSimpleInterpolation()));
            } else {
                text.append(advance());
            }
        }
        flush(text, segments);
        if (segments.isEmpty()) {
            segments.add(StringSegment.text(""));
        }
        addToken(TokenType.STRING, List.copyOf(segments));
    }

    private void flush(StringBuilder text, List<StringSegment> segments) {
        if (!text.isEmpty()) {
            segments.add(StringSegment.text(text.toString()));
            text.setLength(0);
        }
    }

    private String escape() {
        if (isAtEnd()) return "";
        char e = advance();
        switch (e) {
            case 'n': return "\n";
            case 't': return "\t";
            case 'r': return "\r";
            case 'b': return "\b";
            case 'f': return "\f";
            case 'v': return "\u000B";
            case 'x': return codePoint(readHex(2));
            case 'u':
                if (match('{')) {
                    int from = current;
                    while (!isAtEnd() && peek() != '}') advance();
                    String hex = source.substring(from, current);
                    match('}');
                    return codePoint(hex);
                }
                return codePoint(readHex(4));
            default:
                return String.valueOf(e);
        }
    }

    private String readHex(int digits) {
        int from = current;
        for (int i = 0; i < digits && isHexDigit(peek()); i++) advance();
        return source.substring(from, current);
    }

    private String codePoint(String hex) {
        try {
            return new String(Character.toChars(Integer.parseInt(hex, 16)));
        } catch (IllegalArgumentException e) {
            error("Invalid escape sequence: " + hex);
            return "";
        }
    }

    /** Scans {@code $name}; the dollar sign has been consumed. */
    private List<Token> scanSimpleInterpolation() {
        int from = current;
        int col = current - lineStart + 1;
        while (isAlphaNumeric(peek()) && peek() != '$') advance();
        String name = source.substring(from, current);
        TokenType type = KEYWORDS.contains(name) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        return List.of(
                new Token(type, name, null, line, col, logicalFileName),
                new Token(TokenType.END_OF_FILE, "", null, line, col + name.length(), logicalFileName));
    }

    /** Scans the tokens of {@code ${...}} up to the matching brace; the opening has been consumed. */
    private List<Token> scanInterpolation() {
        List<Token> saved = tokens;
        int savedStart = start;
        int savedLine = tokenLine;
        int savedColumn = tokenColumn;
        tokens = new ArrayList<>();
        int depth = 0;
        boolean closed = false;
        while (!isAtEnd()) {
            markStart();
            if (peek() == '}' && depth == 0) {
                advance();
                closed = true;
                break;
            }
            int before = tokens.size();
            scanToken();
            if (tokens.size() > before) {
                TokenType added = tokens.get(tokens.size() - 1).type();
                if (added == TokenType.LEFT_BRACE) depth++;
                if (added == TokenType.RIGHT_BRACE) depth--;
            }
        }
        if (!closed) {
            error("Unterminated string interpolation.");
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, current - lineStart + 1, logicalFileName));
        List<Token> result = tokens;
        tokens = saved;
        start = savedStart;
        tokenLine = savedLine;
        tokenColumn = savedColumn;
        return result;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, tokenLine, tokenColumn, logicalFileName));
    }

    private void error(String message) {
        diagnostics.reportError(message, logicalFileName, tokenLine, tokenColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            lineStart = current;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        if (current + offset >= source.length()) return '\0';
        return source.charAt(current + offset);
    }

    private char previous() {
        return source.charAt(current - 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_' || c == '$';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
