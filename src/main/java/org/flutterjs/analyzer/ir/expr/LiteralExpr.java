package org.flutterjs.analyzer.ir.expr;

/**
 * A literal value. The value is kept as its source text (without quotes for strings)
 * so that it round-trips unchanged through the cache.
 *
 * @param kind  The literal kind.
 * @param value The literal text; {@code "null"} for the null literal.
 */
public record LiteralExpr(Kind kind, String value) implements ExpressionIR {

    public enum Kind { INT, DOUBLE, STRING, BOOL, NULL }

    public static LiteralExpr string(String value) {
        return new LiteralExpr(Kind.STRING, value);
    }

    public static LiteralExpr nullLiteral() {
        return new LiteralExpr(Kind.NULL, "null");
    }
}
