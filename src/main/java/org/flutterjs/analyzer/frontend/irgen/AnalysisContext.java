package org.flutterjs.analyzer.frontend.irgen;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;

/**
 * Read-only view of the project handed to the extractor for one file.
 *
 * @param file     The file being extracted.
 * @param registry The project-wide type registry, already populated for this file and its dependencies.
 * @param graph    The dependency graph of the current run.
 */
public record AnalysisContext(FileIdentity file, SymbolRegistry registry, DependencyGraph graph) {
}
