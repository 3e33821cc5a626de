package org.flutterjs.analyzer.ir.expr;

/**
 * A collection-if element: {@code if (condition) thenElement else elseElement}.
 * The else element is {@code null} when absent.
 */
public record CollectionIfExpr(ExpressionIR condition, ExpressionIR thenElement, ExpressionIR elseElement)
        implements ExpressionIR {
}
