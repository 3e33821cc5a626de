package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.FileIdentity;

/**
 * Thrown by {@link DependencyGraph#topologicalSort()} when it re-enters a file that is still
 * being visited, i.e. when the import graph contains a cycle.
 */
public class CircularDependencyException extends RuntimeException {

    private final FileIdentity offendingFile;

    /**
     * @param offendingFile The file whose re-entry closed the cycle.
     */
    public CircularDependencyException(FileIdentity offendingFile) {
        super("Circular dependency detected at " + offendingFile);
        this.offendingFile = offendingFile;
    }

    /**
     * @return The file whose re-entry closed the cycle.
     */
    public FileIdentity offendingFile() {
        return offendingFile;
    }
}
