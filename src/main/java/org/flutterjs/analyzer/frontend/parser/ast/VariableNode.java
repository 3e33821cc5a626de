package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.Set;

/**
 * One top-level variable.
 */
public record VariableNode(String name, TypeRef type, Set<Modifier> modifiers, ExpressionIR initializer,
                           SourceLocation location) implements AstNode {
}
