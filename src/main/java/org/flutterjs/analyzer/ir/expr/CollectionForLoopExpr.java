package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;

/**
 * A three-part collection-for element: {@code for (initializers; condition; updaters) body}.
 *
 * @param initializers Variable declarations or expression statements of the init part.
 * @param condition    The loop condition, {@code null} when absent.
 * @param updaters     The update expressions.
 * @param body         The element produced per iteration.
 */
public record CollectionForLoopExpr(List<StatementIR> initializers, ExpressionIR condition,
                                    List<ExpressionIR> updaters, ExpressionIR body) implements ExpressionIR {

    public CollectionForLoopExpr {
        initializers = IrLists.copy(initializers);
        updaters = IrLists.copy(updaters);
    }
}
