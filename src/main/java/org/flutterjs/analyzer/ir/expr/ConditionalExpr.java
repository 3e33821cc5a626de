package org.flutterjs.analyzer.ir.expr;

/**
 * The ternary {@code condition ? thenExpression : elseExpression}.
 */
public record ConditionalExpr(ExpressionIR condition, ExpressionIR thenExpression, ExpressionIR elseExpression)
        implements ExpressionIR {
}
