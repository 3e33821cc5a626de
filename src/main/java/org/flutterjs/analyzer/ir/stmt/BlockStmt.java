package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;

import java.util.List;

public record BlockStmt(List<StatementIR> statements) implements StatementIR {

    public BlockStmt {
        statements = IrLists.copy(statements);
    }
}
