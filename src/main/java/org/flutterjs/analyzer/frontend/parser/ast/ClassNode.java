package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A class declaration.
 *
 * @param superclass The {@code extends} clause, {@code null} when absent.
 * @param members    Fields, constructors and methods in source order.
 */
public record ClassNode(String name, boolean abstractClass, List<String> typeParameters, TypeRef superclass,
                        List<TypeRef> mixins, List<TypeRef> interfaces, List<AstNode> members,
                        SourceLocation location) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return members;
    }
}
