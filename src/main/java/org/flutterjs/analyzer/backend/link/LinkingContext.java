package org.flutterjs.analyzer.backend.link;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;
import org.flutterjs.analyzer.frontend.semantics.SymbolRegistry;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.ComponentGraph;
import org.flutterjs.analyzer.ir.FileDeclaration;
import org.flutterjs.analyzer.ir.FunctionDeclaration;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.GraphNode;
import org.flutterjs.analyzer.ir.ImportDeclaration;
import org.flutterjs.analyzer.ir.ObservableStateDeclaration;
import org.flutterjs.analyzer.ir.PlainTypeDeclaration;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;
import org.flutterjs.analyzer.ir.VariableDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable state of one linking pass. Starts out as the concatenation of the per-file
 * declarations and is rewritten by the rules; {@link #build()} freezes it.
 */
public final class LinkingContext {

    private final SymbolRegistry registry;
    private final DependencyGraph graph;
    private final List<FileIdentity> files = new ArrayList<>();
    private final List<ComponentDeclaration> components = new ArrayList<>();
    private final List<StateHolderDeclaration> stateHolders = new ArrayList<>();
    private final List<ObservableStateDeclaration> observableStates = new ArrayList<>();
    private final List<PlainTypeDeclaration> plainTypes = new ArrayList<>();
    private final List<FunctionDeclaration> functions = new ArrayList<>();
    private final List<VariableDeclaration> variables = new ArrayList<>();
    private final List<ImportDeclaration> imports = new ArrayList<>();
    private final Set<GraphEdge> edges = new LinkedHashSet<>();

    /**
     * @param declarations The per-file IR in link order.
     * @param graph        The dependency graph, may be {@code null} when linking in isolation.
     * @param registry     The symbol registry, may be {@code null} when linking in isolation.
     */
    public LinkingContext(List<FileDeclaration> declarations, DependencyGraph graph, SymbolRegistry registry) {
        this.graph = graph;
        this.registry = registry;
        for (FileDeclaration file : declarations) {
            files.add(file.file());
            components.addAll(file.components());
            stateHolders.addAll(file.stateHolders());
            plainTypes.addAll(file.plainTypes());
            functions.addAll(file.functions());
            variables.addAll(file.variables());
            imports.addAll(file.imports());
        }
    }

    public Optional<SymbolRegistry> registry() { return Optional.ofNullable(registry); }

    public Optional<DependencyGraph> graph() { return Optional.ofNullable(graph); }

    public List<FileIdentity> files() { return files; }

    public List<ComponentDeclaration> components() { return components; }

    public List<StateHolderDeclaration> stateHolders() { return stateHolders; }

    public List<ObservableStateDeclaration> observableStates() { return observableStates; }

    public List<PlainTypeDeclaration> plainTypes() { return plainTypes; }

    public List<FunctionDeclaration> functions() { return functions; }

    /**
     * Adds an edge; an identical edge is kept once.
     */
    public void addEdge(String from, String to, GraphEdge.Kind kind, String label) {
        edges.add(new GraphEdge(from, to, kind, label));
    }

    public List<GraphEdge> edges() { return List.copyOf(edges); }

    /**
     * @return The linked application.
     */
    public ApplicationDeclaration build() {
        List<GraphNode> nodes = new ArrayList<>();
        components.forEach(c -> nodes.add(new GraphNode(c.id(), c.name(), GraphNode.Kind.COMPONENT)));
        stateHolders.forEach(s -> nodes.add(new GraphNode(s.id(), s.name(), GraphNode.Kind.STATE_HOLDER)));
        observableStates.forEach(o -> nodes.add(new GraphNode(o.id(), o.name(), GraphNode.Kind.OBSERVABLE_STATE)));

        Map<String, List<String>> fileStructure = new LinkedHashMap<>();
        files.forEach(f -> fileStructure.put(f.path(), new ArrayList<>()));
        components.forEach(c -> structureOf(fileStructure, c.file()).add(c.name()));
        stateHolders.forEach(s -> structureOf(fileStructure, s.file()).add(s.name()));
        observableStates.forEach(o -> structureOf(fileStructure, o.file()).add(o.name()));
        plainTypes.forEach(p -> structureOf(fileStructure, p.file()).add(p.name()));
        fileStructure.replaceAll((file, names) -> List.copyOf(names));

        return new ApplicationDeclaration(files, components, stateHolders, observableStates, plainTypes, functions,
                variables, imports, new ComponentGraph(nodes, List.copyOf(edges)), fileStructure);
    }

    private static List<String> structureOf(Map<String, List<String>> structure, FileIdentity file) {
        return structure.computeIfAbsent(file.path(), k -> new ArrayList<>());
    }
}
