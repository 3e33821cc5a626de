package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.List;

/**
 * One group of {@code case} labels (or {@code default}) with the statements that follow.
 */
public record SwitchCase(List<ExpressionIR> labels, boolean defaultCase, List<StatementIR> statements) {

    public SwitchCase {
        labels = IrLists.copy(labels);
        statements = IrLists.copy(statements);
    }
}
