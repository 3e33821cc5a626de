package org.flutterjs.analyzer.ir.expr;

import org.flutterjs.analyzer.ir.TypeRef;

/**
 * A cast {@code expression as Type}.
 */
public record CastExpr(ExpressionIR expression, TypeRef type) implements ExpressionIR {
}
