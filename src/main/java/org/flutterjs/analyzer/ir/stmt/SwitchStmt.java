package org.flutterjs.analyzer.ir.stmt;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.List;

public record SwitchStmt(ExpressionIR subject, List<SwitchCase> cases) implements StatementIR {

    public SwitchStmt {
        cases = IrLists.copy(cases);
    }
}
