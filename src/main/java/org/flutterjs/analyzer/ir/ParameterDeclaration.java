package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * A formal parameter of a function, method, constructor or function literal.
 *
 * @param name         The parameter name.
 * @param type         The declared type, {@code dynamic} when omitted.
 * @param kind         Positional, optional positional or named.
 * @param required     {@code true} for mandatory positionals and for {@code required} named parameters.
 * @param defaultValue The default value, {@code null} when absent.
 * @param fieldFormal  Whether written as {@code this.name}.
 * @param superFormal  Whether written as {@code super.name}.
 */
public record ParameterDeclaration(String name, TypeRef type, Kind kind, boolean required, ExpressionIR defaultValue,
                                   boolean fieldFormal, boolean superFormal) {

    public enum Kind { POSITIONAL, OPTIONAL_POSITIONAL, NAMED }
}
