package org.flutterjs.analyzer.diagnostics;

/**
 * A single message raised while reading one source file, such as a lexical or syntax error
 * or an extraction problem.
 *
 * @param type The severity of the diagnostic.
 * @param message The human-readable message.
 * @param fileName The file identity the message belongs to.
 * @param lineNumber The 1-based line, or 0 when the position is unknown.
 * @param column The 1-based column, or 0 when the position is unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber,
        int column
) {
    /**
     * Severity of a diagnostic.
     */
    public enum Type {
        /** Makes the file unusable for this run. */
        ERROR,
        /** Worth reporting, the file is still extracted. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d:%d: %s", type, fileName, lineNumber, column, message);
    }
}
