package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A list literal. Elements may be spreads, collection-if or collection-for elements.
 */
public record ListLiteralExpr(TypeRef elementType, List<ExpressionIR> elements, boolean constant) implements ExpressionIR {

    public ListLiteralExpr {
        elements = IrLists.copy(elements);
    }
}
