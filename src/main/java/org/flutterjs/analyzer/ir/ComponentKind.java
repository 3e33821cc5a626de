package org.flutterjs.analyzer.ir;

public enum ComponentKind {
    /** Renders purely from its properties. */
    STATELESS,
    /** Delegates rendering to a bound state holder. */
    STATEFUL
}
