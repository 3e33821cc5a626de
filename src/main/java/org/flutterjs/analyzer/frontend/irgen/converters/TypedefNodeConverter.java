package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.irgen.IrGenContext;
import org.flutterjs.analyzer.frontend.parser.ast.TypedefNode;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.List;

public final class TypedefNodeConverter implements IAstNodeToIrConverter<TypedefNode> {

	@Override
	public void convert(TypedefNode node, IrGenContext ctx) {
		ctx.addPlainType(new PlainTypeDeclaration(
				ctx.declarationId(node.name()),
				node.name(),
				ctx.file(),
				TypeKind.TYPE_ALIAS,
				null,
				node.typeParameters(),
				List.of(),
				List.of(),
				List.of(),
				List.of(),
				List.of(),
				List.of(),
				List.of(),
				node.aliasedType(),
				node.location()));
	}
}
