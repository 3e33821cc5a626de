package org.flutterjs.analyzer.ir;

import java.util.List;
import java.util.Optional;

/**
 * Relationship graph between components, state holders and observable state holders.
 */
public record ComponentGraph(List<GraphNode> nodes, List<GraphEdge> edges) {

    public ComponentGraph {
        nodes = IrLists.copy(nodes);
        edges = IrLists.copy(edges);
    }

    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<GraphEdge> edgesFrom(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<GraphEdge> edgesOfKind(GraphEdge.Kind kind) {
        return edges.stream().filter(e -> e.kind() == kind).toList();
    }
}
