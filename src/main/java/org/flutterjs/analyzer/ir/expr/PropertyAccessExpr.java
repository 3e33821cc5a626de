package org.flutterjs.analyzer.ir.expr;

/**
 * A property read {@code target.name} or {@code target?.name}. The target is {@code null}
 * inside cascade sections.
 */
public record PropertyAccessExpr(ExpressionIR target, String propertyName, boolean nullAware) implements ExpressionIR {
}
