package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;
import java.util.Set;

/**
 * A top-level or local function (or top-level getter/setter).
 */
public record FunctionDeclaration(String id, String name, FileIdentity file, TypeRef returnType,
                                  List<ParameterDeclaration> parameters, StatementIR body, MethodKind kind,
                                  Set<Modifier> modifiers, SourceLocation location) implements Declaration {

    public FunctionDeclaration {
        parameters = IrLists.copy(parameters);
        modifiers = IrLists.copy(modifiers);
    }
}
