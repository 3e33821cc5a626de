package org.flutterjs.analyzer.frontend.parser;

import org.flutterjs.analyzer.diagnostics.Diagnostic;

import java.util.List;

/**
 * Thrown when a source file contains syntax errors. A file that fails to parse contributes
 * no declarations at all.
 */
public class ParseException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * @param message     A summary of the failure.
     * @param diagnostics The reported syntax errors.
     */
    public ParseException(String message, List<Diagnostic> diagnostics) {
        super(message);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return The syntax errors, in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
