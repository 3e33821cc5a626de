package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.MethodNode;
import org.flutterjs.analyzer.ir.FunctionDeclaration;

/**
 * Converts a top-level {@link MethodNode} (function, getter or setter) into a {@link FunctionDeclaration}.
 */
public final class FunctionNodeConverter implements IAstNodeToIrConverter<MethodNode> {

	@Override
	public void convert(MethodNode node, IrGenContext ctx) {
		ctx.addFunction(new FunctionDeclaration(
				ctx.declarationId(Members.memberKey(node)),
				node.name(),
				ctx.file(),
				node.returnType(),
				node.parameters(),
				node.body(),
				node.kind(),
				node.modifiers(),
				node.location()));
	}
}
