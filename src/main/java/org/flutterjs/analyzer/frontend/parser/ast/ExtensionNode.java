package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * An {@code extension ... on T} declaration.
 *
 * @param name The extension name; unnamed extensions get a synthetic name from their position.
 */
public record ExtensionNode(String name, List<String> typeParameters, TypeRef onType, List<AstNode> members,
                            SourceLocation location) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return members;
    }
}
