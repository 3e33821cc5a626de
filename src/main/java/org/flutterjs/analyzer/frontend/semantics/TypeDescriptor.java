package org.flutterjs.analyzer.frontend.semantics;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.SourceLocation;
import org.flutterjs.analyzer.ir.TypeKind;

import java.util.List;

/**
 * Registry entry for one declared type.
 *
 * @param name           The simple type name; unique across the project.
 * @param qualifiedName  The name qualified with its declaring file, {@code <file>#<name>}.
 * @param kind           Class, abstract class, mixin, enum, typedef or extension.
 * @param file           The declaring file.
 * @param supertype      The simple name of the declared superclass, {@code null} when absent.
 * @param interfaces     Implemented interface names.
 * @param mixins         Mixed-in behavior names.
 * @param typeParameters Declared type parameter names.
 * @param roles          UI roles derived from the supertype chain.
 * @param location       Position of the declaration.
 */
public record TypeDescriptor(String name, String qualifiedName, TypeKind kind, FileIdentity file, String supertype,
                             List<String> interfaces, List<String> mixins, List<String> typeParameters,
                             TypeRoles roles, SourceLocation location) {

    public TypeDescriptor {
        interfaces = List.copyOf(interfaces);
        mixins = List.copyOf(mixins);
        typeParameters = List.copyOf(typeParameters);
        if (roles == null) roles = TypeRoles.NONE;
    }

    public boolean isAbstract() {
        return kind == TypeKind.ABSTRACT_CLASS;
    }

    public boolean isComponent() {
        return roles.component();
    }

    public boolean isStatefulComponent() {
        return roles.statefulComponent();
    }

    public boolean isStatelessComponent() {
        return roles.statelessComponent();
    }

    public boolean isStateHolder() {
        return roles.stateHolder();
    }

    public boolean isObservableState() {
        return roles.observableState();
    }
}
