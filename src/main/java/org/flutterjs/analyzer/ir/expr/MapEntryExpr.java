package org.flutterjs.analyzer.ir.expr;

/**
 * A {@code key: value} entry inside a map literal.
 */
public record MapEntryExpr(ExpressionIR key, ExpressionIR value) implements ExpressionIR {
}
