package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.InitializerDeclaration;
import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.ParameterDeclaration;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.stmt.StatementIR;

import java.util.List;
import java.util.Set;

/**
 * A constructor of a class.
 *
 * @param name The constructor name after the dot, {@code null} for the unnamed constructor.
 * @param body The body, {@code null} for {@code ;} bodies.
 */
public record ConstructorNode(String name, List<ParameterDeclaration> parameters, Set<Modifier> modifiers,
                              List<InitializerDeclaration> initializers, StatementIR body,
                              SourceLocation location) implements AstNode {
}
