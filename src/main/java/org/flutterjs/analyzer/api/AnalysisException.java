package org.flutterjs.analyzer.api;

/**
 * Thrown when a project cannot be analyzed at all, e.g. because the project root,
 * its source directory or its manifest is missing.
 * <p>
 * Problems confined to a single file never surface as this exception; they are counted
 * and reported in the {@link AnalysisResult}.
 */
public class AnalysisException extends Exception {

    /**
     * Constructs a new analysis exception with the specified detail message.
     * @param message The detail message.
     */
    public AnalysisException(String message) {
        super(message, null);
    }

    /**
     * Constructs a new analysis exception with the specified detail message and cause.
     * @param message The detail message.
     * @param cause The cause.
     */
    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
