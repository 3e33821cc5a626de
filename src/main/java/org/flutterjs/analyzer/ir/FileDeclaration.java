package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything extracted from one source file. This is the unit stored in the incremental cache.
 *
 * @param file         The file.
 * @param libraryName  The {@code library} name, {@code null} when absent.
 * @param partOf       The library this file is a {@code part of}, {@code null} when it is not a part.
 * @param imports      Import directives in source order.
 * @param exports      Export directives in source order.
 * @param parts        URIs of {@code part} directives.
 * @param components   Declared components.
 * @param stateHolders Declared state holders.
 * @param plainTypes   All other type declarations.
 * @param functions    Top-level functions.
 * @param variables    Top-level variables.
 */
public record FileDeclaration(FileIdentity file, String libraryName, String partOf, List<ImportDeclaration> imports,
                              List<ExportDeclaration> exports, List<String> parts,
                              List<ComponentDeclaration> components, List<StateHolderDeclaration> stateHolders,
                              List<PlainTypeDeclaration> plainTypes, List<FunctionDeclaration> functions,
                              List<VariableDeclaration> variables) {

    public FileDeclaration {
        imports = IrLists.copy(imports);
        exports = IrLists.copy(exports);
        parts = IrLists.copy(parts);
        components = IrLists.copy(components);
        stateHolders = IrLists.copy(stateHolders);
        plainTypes = IrLists.copy(plainTypes);
        functions = IrLists.copy(functions);
        variables = IrLists.copy(variables);
    }

    /**
     * @return The names of all declared types and functions in declaration-kind order.
     */
    public List<String> declaredNames() {
        List<String> names = new ArrayList<>();
        components.forEach(c -> names.add(c.name()));
        stateHolders.forEach(s -> names.add(s.name()));
        plainTypes.forEach(p -> names.add(p.name()));
        functions.forEach(f -> names.add(f.name()));
        return names;
    }
}
