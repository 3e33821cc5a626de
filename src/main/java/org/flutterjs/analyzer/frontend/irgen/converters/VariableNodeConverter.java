package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.VariableNode;
import org.flutterjs.analyzer.ir.VariableDeclaration;

public final class VariableNodeConverter implements IAstNodeToIrConverter<VariableNode> {

	@Override
	public void convert(VariableNode node, IrGenContext ctx) {
		ctx.addVariable(new VariableDeclaration(ctx.declarationId(node.name()), node.name(), ctx.file(), node.type(),
				node.modifiers(), node.initializer(), node.location()));
	}
}
