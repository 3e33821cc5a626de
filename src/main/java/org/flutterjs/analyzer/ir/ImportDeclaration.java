package org.flutterjs.analyzer.ir;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;

/**
 * An {@code import} directive.
 *
 * @param file     The importing file.
 * @param uri      The imported URI as written.
 * @param prefix   The {@code as} prefix, {@code null} when absent.
 * @param show     Names listed in {@code show} combinators.
 * @param hide     Names listed in {@code hide} combinators.
 * @param deferred Whether the import is {@code deferred}.
 * @param location Position of the directive.
 */
public record ImportDeclaration(FileIdentity file, String uri, String prefix, List<String> show, List<String> hide,
                                boolean deferred, SourceLocation location) {

    public ImportDeclaration {
        show = IrLists.copy(show);
        hide = IrLists.copy(hide);
    }
}
