package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A map literal. Plain entries are {@link MapEntryExpr}s; spreads and collection-if/for elements
 * may appear as well.
 */
public record MapLiteralExpr(TypeRef keyType, TypeRef valueType, List<ExpressionIR> entries, boolean constant)
        implements ExpressionIR {

    public MapLiteralExpr {
        entries = IrLists.copy(entries);
    }
}
