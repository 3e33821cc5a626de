package org.flutterjs.analyzer.ir.expr;

/**
 * A binary operation such as {@code a + b}, {@code a && b} or {@code a ?? b}.
 */
public record BinaryExpr(String operator, ExpressionIR left, ExpressionIR right) implements ExpressionIR {
}
