package org.flutterjs.analyzer.ir.expr;

/**
 * A collection-for element: {@code for (final variable in iterable) body}.
 */
public record CollectionForExpr(String variable, ExpressionIR iterable, ExpressionIR body) implements ExpressionIR {
}
