package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.SourceLocation;

/**
 * A structural error; any error makes the application invalid.
 *
 * @param type        The check that failed.
 * @param message     Human-readable description.
 * @param declaration Name of the offending declaration.
 * @param file        Declaring file, may be {@code null} for project-wide findings.
 * @param location    Position in the file.
 */
public record ValidationError(Type type, String message, String declaration, FileIdentity file,
                              SourceLocation location) {

    public enum Type {
        DUPLICATE_DECLARATION,
        MISSING_BUILD_METHOD,
        MISSING_STATE_CLASS,
        CIRCULAR_DEPENDENCY
    }

    @Override
    public String toString() {
        return "[" + type + "] " + message + (file == null ? "" : " (" + file.fileName() + ":" + location + ")");
    }
}
