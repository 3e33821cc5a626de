package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;

import java.util.List;

/**
 * Invocation of an arbitrary expression value, e.g. {@code callbacks[0](x)} or {@code widget.onTap!()}.
 */
public record InvocationExpr(ExpressionIR function, List<Argument> arguments) implements ExpressionIR {

    public InvocationExpr {
        arguments = IrLists.copy(arguments);
    }
}
