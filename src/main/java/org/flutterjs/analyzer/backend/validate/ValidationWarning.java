package org.flutterjs.analyzer.backend.validate;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.ir.SourceLocation;

/**
 * An advisory finding; warnings never make the application invalid.
 *
 * @param type        The check that raised it.
 * @param message     Human-readable description.
 * @param declaration Name of the declaration concerned.
 * @param file        Declaring file, may be {@code null}.
 * @param location    Position in the file.
 */
public record ValidationWarning(Type type, String message, String declaration, FileIdentity file,
                                SourceLocation location) {

    public enum Type {
        REDUNDANT_DEFAULT,
        UNKNOWN_TYPE,
        ORPHANED_STATE_CLASS,
        MISSING_DISPOSE,
        UNDISPOSED_CONTROLLER,
        MISSING_NOTIFY_LISTENERS,
        DUPLICATE_IMPORT,
        DEFERRED_IMPORT
    }

    @Override
    public String toString() {
        return "[" + type + "] " + message + (file == null ? "" : " (" + file.fileName() + ":" + location + ")");
    }
}
