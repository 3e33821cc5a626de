package org.flutterjs.analyzer.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all declaration nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Statements and expressions inside bodies are parsed directly into the IR model,
 * so only directives and declarations are represented as AST nodes.
 */
public interface AstNode {
    /**
     * Returns a list of the direct child nodes.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
