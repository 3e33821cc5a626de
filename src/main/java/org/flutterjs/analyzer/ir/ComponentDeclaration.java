package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;

/**
 * A UI component (a widget).
 *
 * @param id              Stable declaration id.
 * @param name            The class name.
 * @param file            The declaring file.
 * @param kind            Stateless or stateful.
 * @param superclass      The declared superclass.
 * @param typeParameters  Declared type parameter names.
 * @param properties      Fields merged with their constructor parameters.
 * @param fields          All declared fields.
 * @param constructors    All constructors.
 * @param build           The build method, {@code null} if the component declares none.
 * @param methods         Other methods, including {@code createState}.
 * @param mixins          Mixed-in behaviors.
 * @param interfaces      Implemented interfaces.
 * @param stateHolderName For stateful components, the state holder created by {@code createState};
 *                        {@code null} when it could not be determined.
 * @param location        Position of the class name.
 */
public record ComponentDeclaration(String id, String name, FileIdentity file, ComponentKind kind, String superclass,
                                   List<String> typeParameters, List<PropertyDeclaration> properties,
                                   List<FieldDeclaration> fields, List<ConstructorDeclaration> constructors,
                                   BuildDeclaration build, List<MethodDeclaration> methods, List<String> mixins,
                                   List<String> interfaces, String stateHolderName, SourceLocation location)
        implements Declaration {

    public ComponentDeclaration {
        typeParameters = IrLists.copy(typeParameters);
        properties = IrLists.copy(properties);
        fields = IrLists.copy(fields);
        constructors = IrLists.copy(constructors);
        methods = IrLists.copy(methods);
        mixins = IrLists.copy(mixins);
        interfaces = IrLists.copy(interfaces);
    }

    public boolean stateful() {
        return kind == ComponentKind.STATEFUL;
    }
}
