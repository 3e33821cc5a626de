package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * An if statement; {@code elseBranch} is {@code null} when absent.
 */
public record IfStmt(ExpressionIR condition, StatementIR thenBranch, StatementIR elseBranch) implements StatementIR {
}
