package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed import graph over source files. An edge {@code a -> b} means "a imports b".
 * <p>
 * Nodes and adjacency sets are kept sorted so traversals, and with them the topological
 * order, are deterministic across runs. The graph is mutated only while it is being built;
 * afterwards it is shared read-only between worker threads and is not synchronized.
 */
public class DependencyGraph {

    private final Map<FileIdentity, Set<FileIdentity>> dependencies = new TreeMap<>();
    private final Map<FileIdentity, Set<FileIdentity>> dependents = new TreeMap<>();

    /**
     * Adds a node. Adding an existing node has no effect.
     *
     * @param file The file to add.
     */
    public void addNode(FileIdentity file) {
        dependencies.computeIfAbsent(file, k -> new TreeSet<>());
        dependents.computeIfAbsent(file, k -> new TreeSet<>());
    }

    /**
     * Adds the edge "{@code from} imports {@code to}". Missing endpoints are added implicitly
     * and repeated edges are ignored.
     *
     * @param from The importing file.
     * @param to   The imported file.
     */
    public void addEdge(FileIdentity from, FileIdentity to) {
        addNode(from);
        addNode(to);
        dependencies.get(from).add(to);
        dependents.get(to).add(from);
    }

    /**
     * @param file A file.
     * @return {@code true} if the file is a node of this graph.
     */
    public boolean contains(FileIdentity file) {
        return dependencies.containsKey(file);
    }

    /**
     * @return All nodes in sorted order.
     */
    public Set<FileIdentity> nodes() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    /**
     * @return The number of nodes.
     */
    public int size() {
        return dependencies.size();
    }

    /**
     * @return The number of edges.
     */
    public int edgeCount() {
        return dependencies.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * @param file A file.
     * @return The files {@code file} imports directly; empty for unknown files.
     */
    public Set<FileIdentity> dependenciesOf(FileIdentity file) {
        return Collections.unmodifiableSet(dependencies.getOrDefault(file, Collections.emptySet()));
    }

    /**
     * @param file A file.
     * @return The files importing {@code file} directly; empty for unknown files.
     */
    public Set<FileIdentity> dependentsOf(FileIdentity file) {
        return Collections.unmodifiableSet(dependents.getOrDefault(file, Collections.emptySet()));
    }

    /**
     * Collects every file that depends on {@code file}, directly or through other files.
     * The file itself is included only when it sits on a cycle.
     *
     * @param file The changed file.
     * @return All transitive dependents.
     */
    public Set<FileIdentity> transitiveDependentsOf(FileIdentity file) {
        return reachable(file, dependents);
    }

    /**
     * Collects every file that {@code file} imports, directly or through other files.
     *
     * @param file A file.
     * @return All transitive dependencies.
     */
    public Set<FileIdentity> transitiveDependenciesOf(FileIdentity file) {
        return reachable(file, dependencies);
    }

    private Set<FileIdentity> reachable(FileIdentity start, Map<FileIdentity, Set<FileIdentity>> adjacency) {
        Set<FileIdentity> seen = new LinkedHashSet<>();
        Deque<FileIdentity> queue = new ArrayDeque<>(adjacency.getOrDefault(start, Collections.emptySet()));
        while (!queue.isEmpty()) {
            FileIdentity next = queue.poll();
            if (seen.add(next)) {
                queue.addAll(adjacency.getOrDefault(next, Collections.emptySet()));
            }
        }
        return seen;
    }

    /**
     * Orders all files so that every file comes after the files it imports.
     *
     * @return The files, dependencies first.
     * @throws CircularDependencyException as soon as a file is re-entered while still being visited.
     */
    public List<FileIdentity> topologicalSort() {
        List<FileIdentity> order = new ArrayList<>(dependencies.size());
        Set<FileIdentity> visiting = new HashSet<>();
        Set<FileIdentity> visited = new HashSet<>();
        for (FileIdentity file : dependencies.keySet()) {
            visit(file, visiting, visited, order);
        }
        return order;
    }

    private void visit(FileIdentity file, Set<FileIdentity> visiting, Set<FileIdentity> visited, List<FileIdentity> order) {
        if (visited.contains(file)) return;
        if (!visiting.add(file)) {
            throw new CircularDependencyException(file);
        }
        for (FileIdentity dependency : dependencies.get(file)) {
            visit(dependency, visiting, visited, order);
        }
        visiting.remove(file);
        visited.add(file);
        order.add(file);
    }

    /**
     * Returns {@code true} if {@link #topologicalSort()} fails on this graph.
     *
     * @return whether the graph is cyclic according to the sort.
     */
    public boolean hasCircularDependencies() {
        try {
            topologicalSort();
            return false;
        } catch (CircularDependencyException e) {
            return true;
        }
    }

    /**
     * Enumerates cycles with a depth-first walk that keeps the current path on a stack.
     * Every back-edge into the path yields one cycle and the walk continues, so the result
     * can contain overlapping cycles reached from different entry points.
     *
     * @return {@link CycleReport.Acyclic} or the discovered cycles.
     */
    public CycleReport detectCycles() {
        List<List<FileIdentity>> cycles = new ArrayList<>();
        Set<FileIdentity> visited = new HashSet<>();
        Set<FileIdentity> onPath = new HashSet<>();
        List<FileIdentity> path = new ArrayList<>();
        for (FileIdentity file : dependencies.keySet()) {
            if (!visited.contains(file)) {
                collectCycles(file, visited, onPath, path, cycles);
            }
        }
        return cycles.isEmpty() ? new CycleReport.Acyclic() : new CycleReport.Cyclic(cycles);
    }

    private void collectCycles(FileIdentity file, Set<FileIdentity> visited, Set<FileIdentity> onPath,
                               List<FileIdentity> path, List<List<FileIdentity>> cycles) {
        visited.add(file);
        onPath.add(file);
        path.add(file);
        for (FileIdentity dependency : dependencies.get(file)) {
            if (onPath.contains(dependency)) {
                List<FileIdentity> cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                cycle.add(dependency);
                cycles.add(cycle);
            } else if (!visited.contains(dependency)) {
                collectCycles(dependency, visited, onPath, path, cycles);
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(file);
    }

    @Override
    public String toString() {
        return "DependencyGraph[nodes=" + size() + ", edges=" + edgeCount() + "]";
    }
}
