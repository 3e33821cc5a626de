package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.ExtensionNode;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.List;

/**
 * Converts an {@link ExtensionNode}; the extended type is recorded as the single {@code on} type.
 */
public final class ExtensionNodeConverter implements IAstNodeToIrConverter<ExtensionNode> {

	@Override
	public void convert(ExtensionNode node, IrGenContext ctx) {
		ctx.addPlainType(new PlainTypeDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				TypeKind.EXTENSION,
				null,
				node.typeParameters(),
				List.of(),
				List.of(),
				node.onType() == null ? List.of() : Members.names(List.of(node.onType())),
				Members.fields(node.members()),
				List.of(),
				Members.methods(ctx, node.name(), node.members()),
				List.of(),
				null,
				node.location()));
	}
}
