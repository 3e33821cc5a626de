package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One node of a reconstructed component tree: an instance creation found in a build method,
 * with its child-like arguments expanded into nested nodes.
 *
 * @param type            The created component type, e.g. {@code Scaffold}.
 * @param constructorName The named constructor, {@code null} for the unnamed one.
 * @param slot            The argument this node was passed as ({@code child}, {@code body}, ...), {@code null} for roots.
 * @param properties      Remaining named arguments.
 * @param children        Nested component nodes in source order.
 * @param location        Position of the creation, when known.
 */
public record ComponentNode(String type, String constructorName, String slot, Map<String, ExpressionIR> properties,
                            List<ComponentNode> children, SourceLocation location) {

    public ComponentNode {
        properties = IrLists.copy(properties);
        children = IrLists.copy(children);
    }

    /**
     * @return The type names of this node and all its descendants, depth first.
     */
    public List<String> typeNames() {
        List<String> names = new ArrayList<>();
        collect(this, names);
        return names;
    }

    private static void collect(ComponentNode node, List<String> names) {
        names.add(node.type());
        for (ComponentNode child : node.children()) {
            collect(child, names);
        }
    }
}
