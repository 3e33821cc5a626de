package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.frontend.parser.ast.AstNode;

/**
 * Fallback converter used when no specific converter is registered.
 * It adds nothing and reports a warning.
 */
public final class DefaultAstNodeToIrConverter implements IAstNodeToIrConverter<AstNode> {

	@Override
	public void convert(AstNode node, IrGenContext ctx) {
		ctx.diagnostics().reportWarning(
				"IR: No converter registered for node type " + node.getClass().getSimpleName(),
				ctx.file().path(),
				-1,
				-1
		);
	}
}
