package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.frontend.parser.ast.AstNode;

/**
 * Converts a specific AST node type into declarations of the per-file IR.
 * <p>
 * Implementations should be stateless. All output must be added via the provided {@link IrGenContext}.
 *
 * @param <T> The concrete AST node type handled by this converter.
 */
public interface IAstNodeToIrConverter<T extends AstNode> {

	/**
	 * Converts the given AST node and records the result in the context.
	 *
	 * @param node The AST node to convert.
	 * @param ctx  The IR generation context used to collect declarations and access diagnostics.
	 */
	void convert(T node, IrGenContext ctx);
}
