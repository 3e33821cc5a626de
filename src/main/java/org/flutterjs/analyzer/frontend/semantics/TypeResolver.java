package org.flutterjs.analyzer.frontend.semantics;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.parser.ParsedUnit;
import org.flutterjs.analyzer.frontend.parser.ast.AstNode;
import org.flutterjs.analyzer.frontend.parser.ast.ClassNode;
import org.flutterjs.analyzer.frontend.parser.ast.EnumNode;
import org.flutterjs.analyzer.frontend.parser.ast.ExtensionNode;
import org.flutterjs.analyzer.frontend.parser.ast.MixinNode;
import org.flutterjs.analyzer.frontend.parser.ast.TypedefNode;
import org.flutterjs.analyzer.ir.TypeKind;
import org.flutterjs.analyzer.ir.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Collects the type declarations of one compilation unit into {@link TypeDescriptor}s and
 * derives their UI roles.
 * <p>
 * Roles are found by walking the supertype chain: first through the unit's own declarations,
 * then through the registry, which already holds every type of the files this unit depends on
 * when files are resolved in dependency order.
 */
public class TypeResolver {

    static final String STATELESS_ROOT = "StatelessWidget";
    static final String STATEFUL_ROOT = "StatefulWidget";
    static final String STATE_ROOT = "State";
    static final Set<String> WIDGET_ROOTS = Set.of(
            "Widget", "InheritedWidget", "RenderObjectWidget", "ProxyWidget", "PreferredSizeWidget");
    public static final Set<String> OBSERVABLE_ROOTS = Set.of("ChangeNotifier", "ValueNotifier");

    private static final int MAX_CHAIN_DEPTH = 64;

    private final SymbolRegistry registry;

    /**
     * @param registry The registry consulted for supertypes declared in other files.
     */
    public TypeResolver(SymbolRegistry registry) {
        this.registry = registry;
    }

    /** The inheritance-relevant part of a declaration. */
    private record Shape(String supertype, List<String> mixins, List<String> interfaces) {
    }

    /**
     * Builds descriptors for all type declarations of a unit. The registry is not modified.
     *
     * @param unit The parsed file.
     * @return The descriptors in declaration order.
     */
    public List<TypeDescriptor> resolve(ParsedUnit unit) {
        FileIdentity file = unit.file();
        Map<String, Shape> local = new LinkedHashMap<>();
        List<AstNode> typeNodes = new ArrayList<>();
        for (AstNode node : unit.declarations()) {
            Shape shape = shapeOf(node);
            if (shape != null) {
                local.put(nameOf(node), shape);
                typeNodes.add(node);
            }
        }

        Function<String, Optional<Shape>> lookup = name -> {
            Shape shape = local.get(name);
            if (shape != null) return Optional.of(shape);
            return registry.lookup(name).map(d -> new Shape(d.supertype(), d.mixins(), d.interfaces()));
        };

        List<TypeDescriptor> descriptors = new ArrayList<>();
        for (AstNode node : typeNodes) {
            String name = nameOf(node);
            Shape shape = local.get(name);
            TypeRoles roles = classify(shape, lookup);
            descriptors.add(descriptorOf(node, file, shape, roles));
        }
        return descriptors;
    }

    /**
     * Derives roles for a type that is not (yet) registered, using the registry for the chain.
     *
     * @param supertype  The declared superclass, may be {@code null}.
     * @param mixins     Mixed-in names.
     * @param interfaces Implemented interface names.
     * @return The roles.
     */
    public TypeRoles rolesOf(String supertype, List<String> mixins, List<String> interfaces) {
        return classify(new Shape(supertype, mixins, interfaces),
                name -> registry.lookup(name).map(d -> new Shape(d.supertype(), d.mixins(), d.interfaces())));
    }

    /**
     * Superclass roots take precedence over mixins and interfaces anywhere in the chain, so
     * {@code extends StatelessWidget implements PreferredSizeWidget} stays a stateless component.
     */
    private TypeRoles classify(Shape start, Function<String, Optional<Shape>> lookup) {
        List<Shape> chain = chainOf(start, lookup);
        for (Shape shape : chain) {
            if (shape.supertype() == null) continue;
            String superName = simpleName(shape.supertype());
            if (superName.equals(STATELESS_ROOT)) return TypeRoles.STATELESS;
            if (superName.equals(STATEFUL_ROOT)) return TypeRoles.STATEFUL;
            if (superName.equals(STATE_ROOT)) return TypeRoles.STATE_HOLDER;
            if (WIDGET_ROOTS.contains(superName)) return TypeRoles.COMPONENT;
            if (OBSERVABLE_ROOTS.contains(superName)) return TypeRoles.OBSERVABLE;
        }
        for (Shape shape : chain) {
            if (shape.mixins().stream().map(TypeResolver::simpleName).anyMatch(OBSERVABLE_ROOTS::contains)) {
                return TypeRoles.OBSERVABLE;
            }
            if (shape.interfaces().stream().map(TypeResolver::simpleName).anyMatch(WIDGET_ROOTS::contains)) {
                return TypeRoles.COMPONENT;
            }
        }
        return TypeRoles.NONE;
    }

    private static List<Shape> chainOf(Shape start, Function<String, Optional<Shape>> lookup) {
        List<Shape> chain = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Shape shape = start;
        while (shape != null && chain.size() < MAX_CHAIN_DEPTH) {
            chain.add(shape);
            if (shape.supertype() == null) break;
            String superName = simpleName(shape.supertype());
            if (!seen.add(superName)) break;
            shape = lookup.apply(superName).orElse(null);
        }
        return chain;
    }

    /**
     * @param name A possibly prefixed type name such as {@code ui.State}.
     * @return The name without its import prefix.
     */
    public static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }

    private static Shape shapeOf(AstNode node) {
        if (node instanceof ClassNode c) {
            return new Shape(c.superclass() == null ? null : simpleName(c.superclass().name()),
                    names(c.mixins()), names(c.interfaces()));
        }
        if (node instanceof MixinNode m) return new Shape(null, List.of(), names(m.interfaces()));
        if (node instanceof EnumNode e) return new Shape(null, names(e.mixins()), names(e.interfaces()));
        if (node instanceof ExtensionNode) return new Shape(null, List.of(), List.of());
        if (node instanceof TypedefNode) return new Shape(null, List.of(), List.of());
        return null;
    }

    private static String nameOf(AstNode node) {
        if (node instanceof ClassNode c) return c.name();
        if (node instanceof MixinNode m) return m.name();
        if (node instanceof EnumNode e) return e.name();
        if (node instanceof ExtensionNode x) return x.name();
        if (node instanceof TypedefNode t) return t.name();
        throw new IllegalArgumentException("Not a type declaration: " + node.getClass().getSimpleName());
    }

    private static TypeDescriptor descriptorOf(AstNode node, FileIdentity file, Shape shape, TypeRoles roles) {
        String name = nameOf(node);
        String qualified = file.path() + "#" + name;
        if (node instanceof ClassNode c) {
            return new TypeDescriptor(name, qualified, c.abstractClass() ? TypeKind.ABSTRACT_CLASS : TypeKind.CLASS,
                    file, shape.supertype(), shape.interfaces(), shape.mixins(), c.typeParameters(), roles, c.location());
        }
        if (node instanceof MixinNode m) {
            return new TypeDescriptor(name, qualified, TypeKind.MIXIN, file, null, shape.interfaces(), List.of(),
                    m.typeParameters(), roles, m.location());
        }
        if (node instanceof EnumNode e) {
            return new TypeDescriptor(name, qualified, TypeKind.ENUM, file, null, shape.interfaces(), shape.mixins(),
                    List.of(), roles, e.location());
        }
        if (node instanceof ExtensionNode x) {
            return new TypeDescriptor(name, qualified, TypeKind.EXTENSION, file, null, List.of(), List.of(),
                    x.typeParameters(), roles, x.location());
        }
        TypedefNode t = (TypedefNode) node;
        return new TypeDescriptor(name, qualified, TypeKind.TYPE_ALIAS, file, null, List.of(), List.of(),
                t.typeParameters(), roles, t.location());
    }

    private static List<String> names(List<TypeRef> types) {
        List<String> names = new ArrayList<>(types.size());
        for (TypeRef type : types) {
            names.add(simpleName(type.name()));
        }
        return names;
    }
}
