package org.flutterjs.analyzer.backend.link;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.module.CircularDependencyException;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Linking pass: merges the per-file IR into one {@link ApplicationDeclaration} and derives the
 * component graph by running the registered {@link ILinkingRule}s in order.
 */
public final class DeclarationLinker {

    private static final Logger LOG = LoggerFactory.getLogger(DeclarationLinker.class);

    private final LinkingRegistry registry;

    /**
     * Constructs a linker with the default rules.
     */
    public DeclarationLinker() { this(LinkingRegistry.initializeWithDefaults()); }

    /**
     * Constructs a new linker.
     * @param registry The registry of linking rules to apply.
     */
    public DeclarationLinker(LinkingRegistry registry) { this.registry = registry; }

    /**
     * Links the per-file IR of a project. Files are merged in dependency order when the graph
     * is acyclic, otherwise in path order, so the output does not depend on map iteration order.
     *
     * @param fileDeclarations The per-file IR keyed by file.
     * @param graph            The dependency graph of the run.
     * @param symbols          The populated symbol registry.
     * @return The linked application.
     */
    public ApplicationDeclaration link(Map<FileIdentity, FileDeclaration> fileDeclarations, DependencyGraph graph,
                                       SymbolRegistry symbols) {
        Map<FileIdentity, FileDeclaration> remaining = new TreeMap<>(fileDeclarations);
        List<FileDeclaration> ordered = new ArrayList<>(remaining.size());
        if (graph != null) {
            try {
                for (FileIdentity file : graph.topologicalSort()) {
                    FileDeclaration declaration = remaining.remove(file);
                    if (declaration != null) ordered.add(declaration);
                }
            } catch (CircularDependencyException e) {
                LOG.warn("Linking in path order, dependency graph has a cycle at {}", e.offendingFile());
                remaining = new TreeMap<>(fileDeclarations);
                ordered.clear();
            }
        }
        ordered.addAll(remaining.values());
        return link(ordered, graph, symbols);
    }

    /**
     * Links per-file IR in the given order.
     *
     * @param ordered The per-file IR in link order.
     * @param graph   The dependency graph, may be {@code null}.
     * @param symbols The symbol registry, may be {@code null}.
     * @return The linked application.
     */
    public ApplicationDeclaration link(List<FileDeclaration> ordered, DependencyGraph graph, SymbolRegistry symbols) {
        LinkingContext context = new LinkingContext(ordered, graph, symbols);
        for (ILinkingRule rule : registry.rules()) {
            rule.apply(context);
        }
        ApplicationDeclaration application = context.build();
        LOG.debug("Linked {} files: {} components, {} state holders, {} observable states, {} edges",
                ordered.size(), application.components().size(), application.stateHolders().size(),
                application.observableStates().size(), application.componentGraph().edges().size());
        return application;
    }
}
