package org.flutterjs.analyzer.ir.expr;

/**
 * An assignment, simple ({@code =}) or compound ({@code +=}, {@code ??=}, ...).
 */
public record AssignmentExpr(String operator, ExpressionIR target, ExpressionIR value) implements ExpressionIR {
}
