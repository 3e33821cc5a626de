package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A generative, factory or redirecting constructor.
 *
 * @param name         The constructor name, {@code null} for the unnamed constructor.
 * @param parameters   The formal parameters.
 * @param modifiers    {@code const}, {@code factory} or {@code external}.
 * @param initializers The initializer list.
 * @param body         The body, {@code null} when absent.
 * @param location     The position of the constructor.
 */
public record ConstructorDeclaration(String name, List<ParameterDeclaration> parameters, Set<Modifier> modifiers,
                                     List<InitializerDeclaration> initializers, StatementIR body,
                                     SourceLocation location) {

    public ConstructorDeclaration {
        parameters = IrLists.copy(parameters);
        modifiers = IrLists.copy(modifiers);
        initializers = IrLists.copy(initializers);
    }

    public Optional<ParameterDeclaration> parameter(String parameterName) {
        return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
    }
}
