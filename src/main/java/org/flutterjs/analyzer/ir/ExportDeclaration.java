package org.flutterjs.analyzer.ir;

import java.util.List;

/**
 * An {@code export} directive.
 */
public record ExportDeclaration(String uri, List<String> show, List<String> hide, SourceLocation location) {

    public ExportDeclaration {
        show = IrLists.copy(show);
        hide = IrLists.copy(hide);
    }
}
