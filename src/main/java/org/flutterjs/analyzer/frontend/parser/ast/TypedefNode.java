package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.List;

/**
 * A {@code typedef}. Function type aliases record {@code Function} as the aliased type.
 */
public record TypedefNode(String name, List<String> typeParameters, TypeRef aliasedType,
                          SourceLocation location) implements AstNode {
}
