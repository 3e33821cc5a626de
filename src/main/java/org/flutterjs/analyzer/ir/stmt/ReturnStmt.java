package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * A return statement; {@code value} is {@code null} for a bare {@code return;}.
 */
public record ReturnStmt(ExpressionIR value) implements StatementIR {
}
