package org.flutterjs.analyzer.frontend.parser.ast;

import org.flutterjs.analyzer.ir.SourceLocation;

/**
 * A {@code library} directive.
 *
 * @param name The dotted library name, empty for an unnamed library.
 */
public record LibraryNode(String name, SourceLocation location) implements AstNode {
}
