package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;

import java.util.List;

/**
 * A try statement; {@code finallyBlock} is {@code null} when absent.
 */
public record TryStmt(BlockStmt body, List<CatchClause> catchClauses, BlockStmt finallyBlock) implements StatementIR {

    public TryStmt {
        catchClauses = IrLists.copy(catchClauses);
    }
}
