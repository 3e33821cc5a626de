package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;

/**
 * A plain type reclassified during linking because it broadcasts change notifications
 * (it extends or mixes in a notifier root). Consumers read or watch it by its own type name.
 */
public record ObservableStateDeclaration(String id, String name, FileIdentity file, String superclass,
                                         List<String> mixins, List<FieldDeclaration> fields,
                                         List<MethodDeclaration> methods, SourceLocation location)
        implements Declaration {

    public ObservableStateDeclaration {
        mixins = IrLists.copy(mixins);
        fields = IrLists.copy(fields);
        methods = IrLists.copy(methods);
    }

    /**
     * @return The type name consumers use in {@code watch<T>()}, {@code Provider.of<T>} and friends.
     */
    public String valueType() {
        return name;
    }
}
