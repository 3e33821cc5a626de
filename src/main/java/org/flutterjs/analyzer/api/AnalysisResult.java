package org.flutterjs.analyzer.api;

import org.flutterjs.analyzer.backend.validate.ValidationResult;
import org.flutterjs.analyzer.diagnostics.Diagnostic;
import org.flutterjs.analyzer.frontend.module.CycleReport;
import org.flutterjs.analyzer.ir.ApplicationDeclaration;
import org.flutterjs.analyzer.ir.FileDeclaration;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The outcome of one analysis run.
 *
 * @param order            The files in dependency order, dependencies first.
 * @param dirtyFiles       Files that were re-resolved and re-extracted in this run.
 * @param fileDeclarations Per-file IR of every file that succeeded, fresh or cached.
 * @param application      The linked application.
 * @param validation       The structural validation of {@code application}.
 * @param statistics       Run counters.
 * @param diagnostics      Parse and extraction diagnostics of the files that reported any.
 * @param cycles           The advisory cycle report of the dependency graph.
 */
public record AnalysisResult(
        List<FileIdentity> order,
        Set<FileIdentity> dirtyFiles,
        Map<FileIdentity, FileDeclaration> fileDeclarations,
        ApplicationDeclaration application,
        ValidationResult validation,
        AnalysisStatistics statistics,
        Map<FileIdentity, List<Diagnostic>> diagnostics,
        CycleReport cycles
) {

    public AnalysisResult {
        order = List.copyOf(order);
        dirtyFiles = Collections.unmodifiableSortedSet(new TreeSet<>(dirtyFiles));
        fileDeclarations = Collections.unmodifiableSortedMap(new TreeMap<>(fileDeclarations));
        diagnostics = Collections.unmodifiableSortedMap(new TreeMap<>(diagnostics));
    }

    /**
     * @return {@code true} if every file was analyzed and the application is structurally valid.
     */
    public boolean successful() {
        return statistics.errorFiles() == 0 && validation.valid();
    }
}
