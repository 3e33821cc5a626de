package org.flutterjs.analyzer.ir;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reference to a type as written in source, e.g. {@code Map<String, int>?}.
 * Function types are recorded with the name {@code Function}.
 *
 * @param name          The simple type name, possibly prefixed ({@code ui.Color}).
 * @param typeArguments Generic arguments in order.
 * @param nullable      Whether the reference carries a {@code ?}.
 */
public record TypeRef(String name, List<TypeRef> typeArguments, boolean nullable) {

    public TypeRef {
        typeArguments = IrLists.copy(typeArguments);
    }

    /**
     * @param name A non-generic, non-nullable type name.
     * @return The reference.
     */
    public static TypeRef of(String name) {
        return new TypeRef(name, List.of(), false);
    }

    /** The implicit type of untyped declarations. */
    public static TypeRef dynamicType() {
        return of("dynamic");
    }

    /**
     * @return The reference rendered as source text.
     */
    public String displayName() {
        StringBuilder sb = new StringBuilder(name);
        if (!typeArguments.isEmpty()) {
            sb.append(typeArguments.stream().map(TypeRef::displayName).collect(Collectors.joining(", ", "<", ">")));
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }

    @Override
    public String toString() {
        return displayName();
    }
}
