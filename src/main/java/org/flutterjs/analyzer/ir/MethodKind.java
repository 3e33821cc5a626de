package org.flutterjs.analyzer.ir;

public enum MethodKind {
    METHOD,
    GETTER,
    SETTER,
    OPERATOR
}
