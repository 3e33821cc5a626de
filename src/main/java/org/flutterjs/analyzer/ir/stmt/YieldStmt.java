package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * {@code yield value;} or, with {@code star}, {@code yield* values;}.
 */
public record YieldStmt(ExpressionIR value, boolean star) implements StatementIR {
}
