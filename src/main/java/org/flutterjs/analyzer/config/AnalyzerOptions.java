package org.flutterjs.analyzer.config;

import com.typesafe.config.Config;

import java.util.List;

/**
 * Immutable analyzer settings, read from the {@code analyzer} block of the configuration.
 *
 * @param maxParallelism      Upper bound for concurrently processed files and for the batch size.
 * @param parallel            When {@code false}, files are processed one at a time.
 * @param cacheEnabled        Whether hashes and per-file IR are read from and written to disk.
 * @param cacheDirectory      Cache location, relative to the project root unless absolute.
 * @param cacheMemoryEntries  Capacity of the in-memory IR layer in front of the disk cache.
 * @param sourceDirectory     The source root below the project root, usually {@code lib}.
 * @param manifest            The manifest file name below the project root.
 * @param excludes            Glob patterns of files to skip, matched against root-relative paths.
 * @param verbose             Enables debug logging of the analyzer packages.
 */
public record AnalyzerOptions(
        int maxParallelism,
        boolean parallel,
        boolean cacheEnabled,
        String cacheDirectory,
        int cacheMemoryEntries,
        String sourceDirectory,
        String manifest,
        List<String> excludes,
        boolean verbose
) {

    /** The configuration path holding all analyzer settings. */
    public static final String ROOT = "analyzer";

    public AnalyzerOptions {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("max-parallelism must be at least 1, was " + maxParallelism);
        }
        if (cacheMemoryEntries < 1) {
            throw new IllegalArgumentException("cache.memory-entries must be at least 1, was " + cacheMemoryEntries);
        }
        excludes = List.copyOf(excludes);
    }

    /**
     * Reads the options from the {@code analyzer} block of a resolved configuration.
     *
     * @param config The full configuration, including reference defaults.
     * @return The options.
     */
    public static AnalyzerOptions fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        return new AnalyzerOptions(
                c.getInt("max-parallelism"),
                c.getBoolean("parallel"),
                c.getBoolean("cache.enabled"),
                c.getString("cache.directory"),
                c.getInt("cache.memory-entries"),
                c.getString("source-directory"),
                c.getString("manifest"),
                c.getStringList("exclude"),
                c.getBoolean("verbose"));
    }

    /**
     * @return The options from {@code reference.conf} alone.
     */
    public static AnalyzerOptions defaults() {
        return fromConfig(ConfigLoader.load(null));
    }

    /**
     * @return The number of worker threads actually used.
     */
    public int effectiveParallelism() {
        return parallel ? maxParallelism : 1;
    }

    public AnalyzerOptions withMaxParallelism(int value) {
        return new AnalyzerOptions(value, parallel, cacheEnabled, cacheDirectory, cacheMemoryEntries,
                sourceDirectory, manifest, excludes, verbose);
    }

    public AnalyzerOptions withParallel(boolean value) {
        return new AnalyzerOptions(maxParallelism, value, cacheEnabled, cacheDirectory, cacheMemoryEntries,
                sourceDirectory, manifest, excludes, verbose);
    }

    public AnalyzerOptions withCacheEnabled(boolean value) {
        return new AnalyzerOptions(maxParallelism, parallel, value, cacheDirectory, cacheMemoryEntries,
                sourceDirectory, manifest, excludes, verbose);
    }

    public AnalyzerOptions withCacheDirectory(String value) {
        return new AnalyzerOptions(maxParallelism, parallel, cacheEnabled, value, cacheMemoryEntries,
                sourceDirectory, manifest, excludes, verbose);
    }
}
