package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.List;

/**
 * A classic three-part for loop. Every part may be absent.
 *
 * @param initializers Variable declarations or expression statements of the init part.
 * @param condition    The loop condition, {@code null} for an endless loop.
 * @param updaters     The update expressions.
 * @param body         The loop body.
 */
public record ForStmt(List<StatementIR> initializers, ExpressionIR condition, List<ExpressionIR> updaters,
                      StatementIR body) implements StatementIR {

    public ForStmt {
        initializers = IrLists.copy(initializers);
        updaters = IrLists.copy(updaters);
    }
}
