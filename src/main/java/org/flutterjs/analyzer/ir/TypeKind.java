package org.flutterjs.analyzer.ir;

/**
 * The syntactic kind of a type declaration.
 */
public enum TypeKind {
    /** A concrete class. */
    CLASS,
    /** A class declared {@code abstract}. */
    ABSTRACT_CLASS,
    /** A {@code mixin} declaration (behavior mixed into classes). */
    MIXIN,
    /** An {@code enum}. */
    ENUM,
    /** A {@code typedef}. */
    TYPE_ALIAS,
    /** An {@code extension ... on} declaration. */
    EXTENSION
}
