package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The mutable companion of a stateful component ({@code class _CounterState extends State<Counter>}).
 *
 * @param id               Stable declaration id.
 * @param name             The class name.
 * @param file             The declaring file.
 * @param componentName    The component named in {@code State<X>}; empty when the type argument is missing.
 * @param fields           Declared fields, mutable and immutable.
 * @param lifecycleHooks   Overridden lifecycle callbacks.
 * @param build            The build method, {@code null} if absent.
 * @param methods          Other methods.
 * @param controllerFields Names of fields holding controller-like objects that need disposal.
 * @param mixins           Mixed-in behaviors, e.g. {@code SingleTickerProviderStateMixin}.
 * @param location         Position of the class name.
 */
public record StateHolderDeclaration(String id, String name, FileIdentity file, String componentName,
                                     List<FieldDeclaration> fields, Map<LifecycleHook, MethodDeclaration> lifecycleHooks,
                                     BuildDeclaration build, List<MethodDeclaration> methods,
                                     List<String> controllerFields, List<String> mixins, SourceLocation location)
        implements Declaration {

    public StateHolderDeclaration {
        fields = IrLists.copy(fields);
        lifecycleHooks = IrLists.copy(lifecycleHooks);
        methods = IrLists.copy(methods);
        controllerFields = IrLists.copy(controllerFields);
        mixins = IrLists.copy(mixins);
    }

    public Optional<MethodDeclaration> hook(LifecycleHook hook) {
        return Optional.ofNullable(lifecycleHooks.get(hook));
    }

    /**
     * @return Fields that are neither {@code final} nor {@code const}.
     */
    public List<FieldDeclaration> mutableFields() {
        return fields.stream().filter(f -> !f.has(Modifier.FINAL) && !f.has(Modifier.CONST)).toList();
    }
}
