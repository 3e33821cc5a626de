package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

public record AssertStmt(ExpressionIR condition, ExpressionIR message) implements StatementIR {
}
