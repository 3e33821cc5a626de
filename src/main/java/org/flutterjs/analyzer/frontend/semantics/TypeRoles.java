package org.flutterjs.analyzer.frontend.semantics;

/**
 * The UI-domain roles of a type, derived by walking its supertype chain to well-known roots.
 */
public record TypeRoles(boolean component, boolean statefulComponent, boolean statelessComponent,
                        boolean stateHolder, boolean observableState) {

    public static final TypeRoles NONE = new TypeRoles(false, false, false, false, false);
    public static final TypeRoles STATELESS = new TypeRoles(true, false, true, false, false);
    public static final TypeRoles STATEFUL = new TypeRoles(true, true, false, false, false);
    public static final TypeRoles COMPONENT = new TypeRoles(true, false, false, false, false);
    public static final TypeRoles STATE_HOLDER = new TypeRoles(false, false, false, true, false);
    public static final TypeRoles OBSERVABLE = new TypeRoles(false, false, false, false, true);
}
