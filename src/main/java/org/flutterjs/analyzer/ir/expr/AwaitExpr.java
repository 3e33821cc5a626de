package org.flutterjs.analyzer.ir.expr;

public record AwaitExpr(ExpressionIR expression) implements ExpressionIR {
}
