package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * A conditional point in a build method where the rendered tree depends on a runtime value.
 * Both alternatives are kept; either may be {@code null} when that side is not a component.
 *
 * @param condition The condition as written.
 * @param thenTree  The tree rendered when the condition holds.
 * @param elseTree  The tree rendered otherwise.
 */
public record ConditionalBranch(ExpressionIR condition, ComponentNode thenTree, ComponentNode elseTree) {
}
