package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;

/**
 * A {@code part of} directive.
 *
 * @param library The library name or URI this file belongs to.
 */
public record PartOfNode(String library, SourceLocation location) implements AstNode {
}
