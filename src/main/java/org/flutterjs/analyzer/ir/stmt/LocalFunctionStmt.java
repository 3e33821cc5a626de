package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.FunctionDeclaration;

/**
 * A named function declared inside a body.
 */
public record LocalFunctionStmt(FunctionDeclaration function) implements StatementIR {
}
