package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.ir.expr.ExpressionIR;

/**
 * A configurable property of a component: a field merged with the constructor parameter
 * that initializes it.
 *
 * @param name         The property name.
 * @param type         The declared type.
 * @param readOnly     Whether the backing field is {@code final}.
 * @param required     Whether the parameter is {@code required} or annotated {@code @required}.
 * @param defaultValue The parameter default or field initializer, {@code null} when absent.
 * @param location     The position of the field.
 */
public record PropertyDeclaration(String name, TypeRef type, boolean readOnly, boolean required,
                                  ExpressionIR defaultValue, SourceLocation location) {
}
