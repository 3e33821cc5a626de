package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

public record ExpressionStmt(ExpressionIR expression) implements StatementIR {
}
