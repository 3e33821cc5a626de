package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.Modifier;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;
import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.Set;

/**
 * One field of a class body. A declaration like {@code int a = 1, b;} yields two nodes.
 */
public record FieldNode(String name, TypeRef type, Set<Modifier> modifiers, ExpressionIR initializer,
                        SourceLocation location) implements AstNode {
}
