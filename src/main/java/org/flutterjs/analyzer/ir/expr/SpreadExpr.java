package org.flutterjs.analyzer.ir.expr;

/**
 * A collection spread {@code ...items} or {@code ...?items}.
 */
public record SpreadExpr(ExpressionIR expression, boolean nullAware) implements ExpressionIR {
}
