package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * A for-in loop, optionally {@code await for}.
 */
public record ForEachStmt(String variable, TypeRef variableType, ExpressionIR iterable, StatementIR body,
                          boolean awaited) implements StatementIR {
}
