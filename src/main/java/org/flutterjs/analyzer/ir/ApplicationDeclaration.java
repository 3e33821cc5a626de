package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The linked view of a whole application: the union of all per-file declarations, the
 * reclassified observable state holders and the component relationship graph.
 *
 * @param files            All linked files, dependencies first.
 * @param components       All components.
 * @param stateHolders     All state holders.
 * @param observableStates Plain types reclassified as observable state holders.
 * @param plainTypes       The remaining plain types.
 * @param functions        All top-level functions.
 * @param variables        All top-level variables.
 * @param imports          All import directives.
 * @param componentGraph   The relationship graph.
 * @param fileStructure    File path to the names it declares.
 */
public record ApplicationDeclaration(List<FileIdentity> files, List<ComponentDeclaration> components,
                                     List<StateHolderDeclaration> stateHolders,
                                     List<ObservableStateDeclaration> observableStates,
                                     List<PlainTypeDeclaration> plainTypes, List<FunctionDeclaration> functions,
                                     List<VariableDeclaration> variables, List<ImportDeclaration> imports,
                                     ComponentGraph componentGraph, Map<String, List<String>> fileStructure) {

    public ApplicationDeclaration {
        files = IrLists.copy(files);
        components = IrLists.copy(components);
        stateHolders = IrLists.copy(stateHolders);
        observableStates = IrLists.copy(observableStates);
        plainTypes = IrLists.copy(plainTypes);
        functions = IrLists.copy(functions);
        variables = IrLists.copy(variables);
        imports = IrLists.copy(imports);
        fileStructure = IrLists.copy(fileStructure);
    }

    public Optional<ComponentDeclaration> component(String name) {
        return components.stream().filter(c -> c.name().equals(name)).findFirst();
    }

    public Optional<StateHolderDeclaration> stateHolder(String name) {
        return stateHolders.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    /**
     * @param component A stateful component.
     * @return The state holder bound to it, i.e. the one whose component name matches.
     */
    public Optional<StateHolderDeclaration> stateHolderOf(ComponentDeclaration component) {
        return stateHolders.stream().filter(s -> s.componentName().equals(component.name())).findFirst();
    }
}
