package org.flutterjs.analyzer.ir.stmt;

/**
 * {@code break} with an optional label.
 */
public record BreakStmt(String label) implements StatementIR {
}
