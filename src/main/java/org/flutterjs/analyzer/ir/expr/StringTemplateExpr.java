package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;

import java.util.List;

/**
 * An interpolated string. Literal segments are string {@link LiteralExpr}s, interpolations are
 * the embedded expressions, in source order.
 */
public record StringTemplateExpr(List<ExpressionIR> parts) implements ExpressionIR {

    public StringTemplateExpr {
        parts = IrLists.copy(parts);
    }
}
