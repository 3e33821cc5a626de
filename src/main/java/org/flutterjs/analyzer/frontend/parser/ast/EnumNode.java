package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * An {@code enum} declaration, possibly enhanced with members.
 */
public record EnumNode(String name, List<String> values, List<TypeRef> mixins, List<TypeRef> interfaces,
                       List<AstNode> members, SourceLocation location) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return members;
    }
}
