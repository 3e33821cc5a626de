package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A set literal such as {@code {1, 2}}.
 */
public record SetLiteralExpr(TypeRef elementType, List<ExpressionIR> elements, boolean constant) implements ExpressionIR {

    public SetLiteralExpr {
        elements = IrLists.copy(elements);
    }
}
