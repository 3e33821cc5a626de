package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.Set;

/**
 * A top-level variable or constant.
 */
public record VariableDeclaration(String id, String name, FileIdentity file, TypeRef type, Set<Modifier> modifiers,
                                  ExpressionIR initializer, SourceLocation location) implements Declaration {

    public VariableDeclaration {
        modifiers = IrLists.copy(modifiers);
    }
}
