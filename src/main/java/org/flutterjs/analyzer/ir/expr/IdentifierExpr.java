package org.flutterjs.analyzer.ir.expr;

/**
 * A simple or prefixed name, including {@code this} and {@code super}.
 */
public record IdentifierExpr(String name) implements ExpressionIR {
}
