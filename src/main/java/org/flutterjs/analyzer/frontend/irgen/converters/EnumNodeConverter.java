package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.EnumNode;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.List;

/**
 * Converts an {@link EnumNode}, including the members of enhanced enums.
 */
public final class EnumNodeConverter implements IAstNodeToIrConverter<EnumNode> {

	@Override
	public void convert(EnumNode node, IrGenContext ctx) {
		ctx.addPlainType(new PlainTypeDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				TypeKind.ENUM,
				null,
				List.of(),
				Members.names(node.mixins()),
				Members.names(node.interfaces()),
				List.of(),
				Members.fields(node.members()),
				Members.constructors(node.members()),
				Members.methods(ctx, node.name(), node.members()),
				node.values(),
				null,
				node.location()));
	}
}
