package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A {@code mixin} declaration.
 */
public record MixinNode(String name, List<String> typeParameters, List<TypeRef> onTypes, List<TypeRef> interfaces,
                        List<AstNode> members, SourceLocation location) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return members;
    }
}
