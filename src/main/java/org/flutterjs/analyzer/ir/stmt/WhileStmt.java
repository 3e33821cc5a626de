package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

public record WhileStmt(ExpressionIR condition, StatementIR body) implements StatementIR {
}
