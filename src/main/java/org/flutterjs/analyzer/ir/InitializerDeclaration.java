package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.Argument;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.List;

/**
 * One entry of a constructor initializer list.
 *
 * @param kind      What the entry does.
 * @param name      The field for {@link Kind#FIELD}, the constructor name for super/redirect calls (may be {@code null}).
 * @param value     The assigned value or asserted condition.
 * @param arguments The arguments of super/redirect calls.
 */
public record InitializerDeclaration(Kind kind, String name, ExpressionIR value, List<Argument> arguments) {

    public enum Kind { FIELD, SUPER, REDIRECT, ASSERT }

    public InitializerDeclaration {
        arguments = IrLists.copy(arguments);
    }
}
