package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.diagnostics.DiagnosticsEngine;
import org.flutterjs.analyzer.frontend.parser.ParsedUnit;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Phase: Extracts the per-file declaration IR from a parsed unit by delegating each
 * top-level declaration to a converter resolved via the {@link IrConverterRegistry}.
 * <p>
 * Instances hold no per-file state and may be shared between worker threads.
 */
public final class IrExtractor {

	private static final Logger LOG = LoggerFactory.getLogger(IrExtractor.class);

	private final IrConverterRegistry registry;

	/**
	 * Creates an extractor with the standard converters.
	 */
	public IrExtractor() {
		this(IrConverterRegistry.initializeWithDefaults());
	}

	/**
	 * Creates an extractor with a prepared registry.
	 *
	 * @param registry The converter registry.
	 */
	public IrExtractor(IrConverterRegistry registry) {
		this.registry = registry;
	}

	/**
	 * Extracts the declarations of one file.
	 *
	 * @param unit        The parsed file.
	 * @param context     The read-only project view; its file must be the unit's file.
	 * @param diagnostics Receives warnings raised during extraction.
	 * @return The per-file IR.
	 */
	public FileDeclaration extract(ParsedUnit unit, AnalysisContext context, DiagnosticsEngine diagnostics) {
		if (!unit.file().equals(context.file())) {
			throw new IllegalArgumentException("Unit " + unit.file() + " does not match context file " + context.file());
		}
		IrGenContext ctx = new IrGenContext(context, diagnostics, registry);
		for (AstNode node : unit.declarations()) {
			registry.resolve(node).convert(node, ctx);
		}
		FileDeclaration declaration = ctx.build();
		LOG.debug("Extracted {}: {} components, {} state holders, {} plain types, {} functions",
				unit.file().fileName(), declaration.components().size(), declaration.stateHolders().size(),
				declaration.plainTypes().size(), declaration.functions().size());
		return declaration;
	}
}
