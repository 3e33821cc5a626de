package org.flutterjs.analyzer.ir.stmt;

/**
 * {@code continue} with an optional label.
 */
public record ContinueStmt(String label) implements StatementIR {
}
