package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A call of a named method or function: {@code target.name<T>(args)} or {@code name(args)}.
 *
 * @param target        The receiver; {@code null} for unqualified calls and cascade sections.
 * @param methodName    The invoked name.
 * @param typeArguments Explicit type arguments, e.g. {@code watch<Counter>()}.
 * @param arguments     The arguments in source order.
 * @param nullAware     Whether the call was written with {@code ?.}.
 */
public record MethodCallExpr(ExpressionIR target, String methodName, List<TypeRef> typeArguments,
                             List<Argument> arguments, boolean nullAware) implements ExpressionIR {

    public MethodCallExpr {
        typeArguments = IrLists.copy(typeArguments);
        arguments = IrLists.copy(arguments);
    }
}
