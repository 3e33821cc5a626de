package org.flutterjs.analyzer.ir.expr;

/**
 * A prefix ({@code -x}, {@code !x}, {@code ++x}) or postfix ({@code x++}, {@code x!}) operation.
 */
public record UnaryExpr(String operator, ExpressionIR operand, boolean prefix) implements ExpressionIR {
}
