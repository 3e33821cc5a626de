package org.flutterjs.analyzer.ir.expr;

/**
 * An index operation {@code target[index]} or {@code target?[index]}.
 */
public record IndexExpr(ExpressionIR target, ExpressionIR index, boolean nullAware) implements ExpressionIR {
}
