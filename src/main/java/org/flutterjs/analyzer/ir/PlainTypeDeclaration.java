package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;

/**
 * Any type declaration that is neither a component nor a state holder: models, services,
 * mixins, enums, typedefs and extensions.
 *
 * @param aliasedType For typedefs, the aliased type; otherwise {@code null}.
 * @param onTypes     For mixins the {@code on} constraints, for extensions the extended type.
 * @param enumValues  For enums, the constant names in order.
 */
public record PlainTypeDeclaration(String id, String name, FileIdentity file, TypeKind kind, String superclass,
                                   List<String> typeParameters, List<String> mixins, List<String> interfaces,
                                   List<String> onTypes, List<FieldDeclaration> fields,
                                   List<ConstructorDeclaration> constructors, List<MethodDeclaration> methods,
                                   List<String> enumValues, TypeRef aliasedType, SourceLocation location)
        implements Declaration {

    public PlainTypeDeclaration {
        typeParameters = IrLists.copy(typeParameters);
        mixins = IrLists.copy(mixins);
        interfaces = IrLists.copy(interfaces);
        onTypes = IrLists.copy(onTypes);
        fields = IrLists.copy(fields);
        constructors = IrLists.copy(constructors);
        methods = IrLists.copy(methods);
        enumValues = IrLists.copy(enumValues);
    }
}
