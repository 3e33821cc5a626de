package org.flutterjs.analyzer.ir.expr;

/**
 * One argument of a call or instance creation.
 *
 * @param name  The parameter name for named arguments, {@code null} for positional ones.
 * @param value The argument expression.
 */
public record Argument(String name, ExpressionIR value) {

    public boolean named() {
        return name != null;
    }
}
