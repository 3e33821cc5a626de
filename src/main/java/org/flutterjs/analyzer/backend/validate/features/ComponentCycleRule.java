package org.flutterjs.analyzer.backend.validate.features;

import org.flutterjs.analyzer.backend.validate.IValidationRule;
import org.flutterjs.analyzer.backend.validate.ValidationContext;
import org.flutterjs.analyzer.backend.validate.ValidationError;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.ComponentGraph;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.GraphNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reports cycles in the component graph, e.g. two components rendering each other. Uses a
 * depth-first search with an explicit recursion stack; each cycle is reported once regardless
 * of where the search entered it.
 */
public class ComponentCycleRule implements IValidationRule {

    @Override
    public void validate(ValidationContext context) {
        ComponentGraph graph = context.application().componentGraph();
        Map<String, List<String>> successors = new HashMap<>();
        for (GraphEdge edge : graph.edges()) {
            successors.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }
        Map<String, String> names = new HashMap<>();
        for (GraphNode node : graph.nodes()) {
            names.put(node.id(), node.name());
        }

        Set<String> visited = new HashSet<>();
        Set<List<String>> reported = new HashSet<>();
        for (GraphNode node : graph.nodes()) {
            if (!visited.contains(node.id())) {
                dfs(node.id(), successors, visited, new LinkedHashSet<>(), new ArrayList<>(), reported, names, context);
            }
        }
    }

    private static void dfs(String id, Map<String, List<String>> successors, Set<String> visited, Set<String> onStack,
                            List<String> path, Set<List<String>> reported, Map<String, String> names,
                            ValidationContext context) {
        visited.add(id);
        onStack.add(id);
        path.add(id);
        for (String next : successors.getOrDefault(id, List.of())) {
            if (onStack.contains(next)) {
                List<String> cycle = canonical(path.subList(path.indexOf(next), path.size()));
                if (reported.add(cycle)) report(cycle, names, context);
            } else if (!visited.contains(next)) {
                dfs(next, successors, visited, onStack, path, reported, names, context);
            }
        }
        path.remove(path.size() - 1);
        onStack.remove(id);
    }

    /**
     * Rotates a cycle so it starts at its smallest id.
     */
    static List<String> canonical(List<String> cycle) {
        List<String> rotated = new ArrayList<>(cycle);
        int start = rotated.indexOf(Collections.min(rotated));
        Collections.rotate(rotated, -start);
        return List.copyOf(rotated);
    }

    private static void report(List<String> cycle, Map<String, String> names, ValidationContext context) {
        List<String> cycleNames = new ArrayList<>();
        for (String id : cycle) {
            cycleNames.add(names.getOrDefault(id, id));
        }
        cycleNames.add(cycleNames.get(0));
        String first = cycleNames.get(0);
        Optional<ComponentDeclaration> component = context.application().component(first);
        context.error(ValidationError.Type.CIRCULAR_DEPENDENCY,
                "Circular component dependency: " + String.join(" -> ", cycleNames),
                first,
                component.map(ComponentDeclaration::file).orElse(null),
                component.map(ComponentDeclaration::location).orElse(null));
    }
}
