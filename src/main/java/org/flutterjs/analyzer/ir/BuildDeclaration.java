package org.flutterjs.analyzer.ir;

import java.util.ArrayList;
import java.util.List;

/**
 * The {@code build} method of a component or state holder.
 *
 * @param method   The converted method, including its full body.
 * @param tree     The primary rendered tree; for a conditional return this is the first branch.
 *                 {@code null} when the return value is not an instance creation.
 * @param branches Conditional points found while reconstructing the tree, with both alternatives.
 */
public record BuildDeclaration(MethodDeclaration method, ComponentNode tree, List<ConditionalBranch> branches) {

    public BuildDeclaration {
        branches = IrLists.copy(branches);
    }

    /**
     * @return Every component type referenced by the primary tree and by all branch alternatives.
     */
    public List<String> referencedTypes() {
        List<String> names = new ArrayList<>();
        if (tree != null) names.addAll(tree.typeNames());
        for (ConditionalBranch branch : branches) {
            if (branch.thenTree() != null) names.addAll(branch.thenTree().typeNames());
            if (branch.elseTree() != null) names.addAll(branch.elseTree().typeNames());
        }
        return names;
    }
}
