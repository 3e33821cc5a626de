package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.Set;

/**
 * A field of a class, mixin, enum or extension.
 *
 * @param name        The field name.
 * @param type        The declared type, {@code dynamic} when inferred.
 * @param modifiers   Any of {@code final}, {@code const}, {@code static}, {@code late}.
 * @param initializer The initializer, {@code null} when absent.
 * @param location    The position of the field name.
 */
public record FieldDeclaration(String name, TypeRef type, Set<Modifier> modifiers, ExpressionIR initializer,
                               SourceLocation location) {

    public FieldDeclaration {
        modifiers = IrLists.copy(modifiers);
    }

    public boolean has(Modifier modifier) {
        return modifiers.contains(modifier);
    }
}
