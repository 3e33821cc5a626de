package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

public record DoWhileStmt(StatementIR body, ExpressionIR condition) implements StatementIR {
}
