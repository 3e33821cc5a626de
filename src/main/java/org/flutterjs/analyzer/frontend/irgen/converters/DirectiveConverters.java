package org.flutterjs.analyzer.frontend.irgen.converters;

import org.flutterjs.analyzer.frontend.irgen.IAstNodeToIrConverter;
import org.flutterjs.analyzer.frontend.parser.ast.ExportNode;
import org.flutterjs.analyzer.frontend.parser.ast.ImportNode;
import org.flutterjs.analyzer.frontend.parser.ast.LibraryNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartNode;
import org.flutterjs.analyzer.frontend.parser.ast.PartOfNode;
import org.flutterjs.analyzer.ir.ExportDeclaration;
import org.flutterjs.analyzer.ir.ImportDeclaration;

/**
 * Converters for the directives at the top of a file. Each only records the directive in the file header.
 */
public final class DirectiveConverters {

	public static final IAstNodeToIrConverter<LibraryNode> LIBRARY = (node, ctx) -> ctx.libraryName(node.name());

	public static final IAstNodeToIrConverter<PartOfNode> PART_OF = (node, ctx) -> ctx.partOf(node.library());

	public static final IAstNodeToIrConverter<PartNode> PART = (node, ctx) -> ctx.addPart(node.uri());

	public static final IAstNodeToIrConverter<ImportNode> IMPORT = (node, ctx) -> ctx.addImport(
			new ImportDeclaration(ctx.file(), node.uri(), node.prefix(), node.show(), node.hide(), node.deferred(),
					node.location()));

	public static final IAstNodeToIrConverter<ExportNode> EXPORT = (node, ctx) -> ctx.addExport(
			new ExportDeclaration(node.uri(), node.show(), node.hide(), node.location()));

	private DirectiveConverters() {}
}
