package org.flutterjs.analyzer.ir.expr;

/**
 * A {@code throw} expression, or a {@code rethrow} when {@code expression} is {@code null}.
 */
public record ThrowExpr(ExpressionIR expression) implements ExpressionIR {
}
