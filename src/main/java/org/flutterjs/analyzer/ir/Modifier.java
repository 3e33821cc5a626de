package org.flutterjs.analyzer.ir;

/**
 * Declaration modifiers recorded on fields, variables, methods and constructors.
 */
public enum Modifier {
    FINAL,
    CONST,
    STATIC,
    LATE,
    ABSTRACT,
    EXTERNAL,
    ASYNC,
    GENERATOR,
    OVERRIDE,
    FACTORY
}
