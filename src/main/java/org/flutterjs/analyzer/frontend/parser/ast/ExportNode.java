package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;

import java.util.List;

/**
 * An {@code export} directive.
 */
public record ExportNode(String uri, List<String> show, List<String> hide, SourceLocation location) implements AstNode {
}
