package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.MethodKind;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.ParameterDeclaration;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;
import java.util.Set;

/**
 * A method, getter, setter or operator of a type body, or a top-level function.
 *
 * @param body The body; arrow bodies are a single return. {@code null} when abstract or external.
 */
public record MethodNode(String name, TypeRef returnType, List<ParameterDeclaration> parameters, StatementIR body,
                         MethodKind kind, Set<Modifier> modifiers, SourceLocation location) implements AstNode {
}
