package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;

import java.util.List;

/**
 * A cascade {@code target..a()..b = 1}. Each section is an expression whose innermost receiver
 * is {@code null}, standing for the cascade target.
 */
public record CascadeExpr(ExpressionIR target, List<ExpressionIR> sections, boolean nullAware) implements ExpressionIR {

    public CascadeExpr {
        sections = IrLists.copy(sections);
    }
}
