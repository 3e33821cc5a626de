package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.MixinNode;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.List;

/**
 * Converts a {@link MixinNode} into a plain type of kind {@link TypeKind#MIXIN}.
 */
public final class MixinNodeConverter implements IAstNodeToIrConverter<MixinNode> {

	@Override
	public void convert(MixinNode node, IrGenContext ctx) {
		ctx.addPlainType(new PlainTypeDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				TypeKind.MIXIN,
				null,
				node.typeParameters(),
				List.of(),
				Members.names(node.interfaces()),
				Members.names(node.onTypes()),
				Members.fields(node.members()),
				List.of(),
				Members.methods(ctx, node.name(), node.members()),
				List.of(),
				null,
				node.location()));
	}
}
