package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;

import java.util.List;

/**
 * An {@code import} directive with its prefix and combinators.
 */
public record ImportNode(String uri, String prefix, List<String> show, List<String> hide, boolean deferred,
                         SourceLocation location) implements AstNode {
}
