package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.TypeRef;

/**
 * A type test {@code expression is Type} or {@code expression is! Type}.
 */
public record TypeTestExpr(ExpressionIR expression, TypeRef type, boolean negated) implements ExpressionIR {
}
