package org.flutterjs.analyzer.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Counters of one analysis run.
 *
 * @param totalFiles     Files discovered in the project.
 * @param processedFiles Files whose IR was extracted in this run.
 * @param cachedFiles    Files whose IR was read from the cache.
 * @param errorFiles     Files that failed to parse or extract.
 * @param changedFiles   Size of the dirty set.
 * @param batches        Number of extraction batches.
 * @param durationMillis Wall-clock duration of the run.
 */
public record AnalysisStatistics(
        int totalFiles,
        int processedFiles,
        int cachedFiles,
        int errorFiles,
        int changedFiles,
        int batches,
        long durationMillis
) {

    @JsonProperty
    public double cacheHitRate() {
        return totalFiles == 0 ? 0.0 : (double) cachedFiles / totalFiles;
    }

    @JsonProperty
    public double errorRate() {
        return totalFiles == 0 ? 0.0 : (double) errorFiles / totalFiles;
    }

    @JsonProperty
    public double averageMillisPerFile() {
        return totalFiles == 0 ? 0.0 : (double) durationMillis / totalFiles;
    }

    @Override
    public String toString() {
        return String.format("files=%d processed=%d cached=%d errors=%d changed=%d batches=%d duration=%dms cache-hit=%.1f%%",
                totalFiles, processedFiles, cachedFiles, errorFiles, changedFiles, batches, durationMillis,
                cacheHitRate() * 100);
    }
}
