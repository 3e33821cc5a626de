package org.flutterjs.analyzer.backend.link.features;

import org.flutterjs.analyzer.backend.link.ILinkingRule;
import org.flutterjs.analyzer.backend.link.LinkingContext;
import org.flutterjs.analyzer.ir.BuildDeclaration;
import org.flutterjs.analyzer.ir.ComponentDeclaration;
import org.flutterjs.analyzer.ir.ComponentNode;
import org.flutterjs.analyzer.ir.ConditionalBranch;
import org.flutterjs.analyzer.ir.GraphEdge;
import org.flutterjs.analyzer.ir.StateHolderDeclaration;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Adds a composes edge from every component to each project component its build tree renders.
 * The tree of a stateful component is the one built by its state holder. Both alternatives of
 * recorded branches are included. Framework components have no node and are skipped.
 */
public class CompositionLinkingRule implements ILinkingRule {

    @Override
    public void apply(LinkingContext context) {
        Map<String, ComponentDeclaration> byName = new HashMap<>();
        for (ComponentDeclaration component : context.components()) {
            byName.putIfAbsent(component.name(), component);
        }
        for (ComponentDeclaration component : context.components()) {
            BuildDeclaration build = buildOf(component, context);
            if (build == null) continue;
            for (String child : renderedTypes(build)) {
                ComponentDeclaration target = byName.get(child);
                if (target != null) {
                    context.addEdge(component.id(), target.id(), GraphEdge.Kind.COMPOSES, child);
                }
            }
        }
    }

    static BuildDeclaration buildOf(ComponentDeclaration component, LinkingContext context) {
        if (!component.stateful()) return component.build();
        if (component.stateHolderName() == null) return null;
        return context.stateHolders().stream()
                .filter(h -> h.name().equals(component.stateHolderName()))
                .findFirst()
                .map(StateHolderDeclaration::build)
                .orElse(null);
    }

    static Set<String> renderedTypes(BuildDeclaration build) {
        Set<String> types = new LinkedHashSet<>();
        add(types, build.tree());
        for (ConditionalBranch branch : build.branches()) {
            add(types, branch.thenTree());
            add(types, branch.elseTree());
        }
        return types;
    }

    private static void add(Set<String> types, ComponentNode tree) {
        if (tree != null) types.addAll(tree.typeNames());
    }
}
