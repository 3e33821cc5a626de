package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;
import java.util.Set;

/**
 * A method, getter, setter or operator of a type.
 *
 * @param id         Stable id derived from {@code Type.name}.
 * @param name       The method name.
 * @param returnType The declared return type, {@code dynamic} when omitted.
 * @param parameters The formal parameters.
 * @param body       The body; arrow bodies become a single return. {@code null} for abstract methods.
 * @param kind       Method, getter, setter or operator.
 * @param modifiers  Static, abstract, async, generator, override, external.
 * @param location   The position of the method name.
 */
public record MethodDeclaration(String id, String name, TypeRef returnType, List<ParameterDeclaration> parameters,
                                StatementIR body, MethodKind kind, Set<Modifier> modifiers, SourceLocation location) {

    public MethodDeclaration {
        parameters = IrLists.copy(parameters);
        modifiers = IrLists.copy(modifiers);
    }

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }

    /**
     * @return {@code true} if the declared return type is {@code void}.
     */
    public boolean returnsVoid() {
        return returnType != null && "void".equals(returnType.name());
    }
}
