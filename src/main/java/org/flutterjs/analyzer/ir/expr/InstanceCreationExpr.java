package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.IrLists;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;
import java.util.Optional;

/**
 * Creation of an instance, explicit ({@code const Text('a')}, {@code new Foo()}) or implicit
 * ({@code Padding(...)}, {@code EdgeInsets.all(8)}).
 *
 * @param type            The created type.
 * @param constructorName The named constructor, {@code null} for the unnamed one.
 * @param arguments       The arguments in source order.
 * @param constant        Whether the creation is {@code const}.
 */
public record InstanceCreationExpr(TypeRef type, String constructorName, List<Argument> arguments, boolean constant)
        implements ExpressionIR {

    public InstanceCreationExpr {
        arguments = IrLists.copy(arguments);
    }

    /**
     * @param name A parameter name.
     * @return The value of the named argument, if present.
     */
    public Optional<ExpressionIR> namedArgument(String name) {
        return arguments.stream().filter(a -> name.equals(a.name())).map(Argument::value).findFirst();
    }
}
