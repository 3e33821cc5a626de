package org.flutterjs.analyzer.api;

import java.util.function.Consumer;

/**
 * Defines the public interface of the incremental project analyzer.
 */
public interface IProjectAnalyzer extends AutoCloseable {

    /**
     * Runs all phases over the project. Files that are unchanged since the previous run, in this
     * process or an earlier one sharing the cache directory, are served from the cache.
     *
     * @return The linked and validated result.
     * @throws AnalysisException if the project cannot be opened or its dependency graph is cyclic.
     */
    AnalysisResult analyze() throws AnalysisException;

    /**
     * Registers a listener for progress events. Listeners are called from worker threads.
     *
     * @param listener The listener.
     */
    void addProgressListener(Consumer<AnalysisProgress> listener);

    /**
     * @return The phase reached by the current or last run.
     */
    AnalysisPhase phase();

    /**
     * Stops the worker pool.
     */
    @Override
    void close();
}
