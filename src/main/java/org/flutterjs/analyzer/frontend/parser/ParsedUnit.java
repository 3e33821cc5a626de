package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * The syntax tree of one source file.
 *
 * @param file         The parsed file.
 * @param declarations Top-level directives and declarations in source order.
 */
public record ParsedUnit(FileIdentity file, List<AstNode> declarations) {

    public ParsedUnit {
        declarations = List.copyOf(declarations);
    }
}
