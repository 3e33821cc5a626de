package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;

/**
 * A {@code part 'uri';} directive.
 */
public record PartNode(String uri, SourceLocation location) implements AstNode {
}
