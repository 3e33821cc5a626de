package org.flutterjs.analyzer.scheduler;

import org.flutterjs.analyzer.api.FileIdentity;
import org.flutterjs.analyzer.frontend.module.DependencyGraph;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits the dirty files of a run into batches that can be processed concurrently.
 * <p>
 * Files outside the dirty set count as satisfied from the start. A dirty file joins a batch once
 * every one of its direct dependencies is satisfied, i.e. clean or placed in an earlier batch, so
 * no file shares a batch with any of its dependencies. A batch holds at most {@code maxParallelism}
 * files. Batches must be run with a barrier between them.
 */
public final class BatchScheduler {

    private BatchScheduler() {}

    /**
     * @param order          All files in topological order.
     * @param dirty          The files to process.
     * @param graph          The dependency graph.
     * @param maxParallelism The maximum batch size, at least 1.
     * @return The batches in execution order; empty when nothing is dirty.
     * @throws IllegalArgumentException if {@code maxParallelism} is below 1, or the dirty files
     *                                  cannot be ordered because their dependencies form a cycle.
     */
    public static List<List<FileIdentity>> schedule(List<FileIdentity> order, Set<FileIdentity> dirty,
                                                    DependencyGraph graph, int maxParallelism) {
        if (maxParallelism < 1) {
            throw new IllegalArgumentException("maxParallelism must be at least 1, was " + maxParallelism);
        }
        Set<FileIdentity> pending = new LinkedHashSet<>();
        for (FileIdentity file : order) {
            if (dirty.contains(file)) pending.add(file);
        }
        for (FileIdentity file : dirty) {
            if (!pending.contains(file)) pending.add(file);
        }
        Set<FileIdentity> satisfied = new HashSet<>();

        List<List<FileIdentity>> batches = new ArrayList<>();
        while (!pending.isEmpty()) {
            List<FileIdentity> batch = new ArrayList<>(Math.min(maxParallelism, pending.size()));
            for (FileIdentity file : pending) {
                if (batch.size() == maxParallelism) break;
                if (ready(file, dirty, satisfied, graph)) batch.add(file);
            }
            if (batch.isEmpty()) {
                throw new IllegalArgumentException("Cannot schedule " + pending + ": dependencies form a cycle");
            }
            batch.forEach(pending::remove);
            satisfied.addAll(batch);
            batches.add(List.copyOf(batch));
        }
        return batches;
    }

    private static boolean ready(FileIdentity file, Set<FileIdentity> dirty, Set<FileIdentity> satisfied,
                                 DependencyGraph graph) {
        if (!graph.contains(file)) return true;
        for (FileIdentity dependency : graph.dependenciesOf(file)) {
            if (dependency.equals(file)) continue;
            if (dirty.contains(dependency) && !satisfied.contains(dependency)) return false;
        }
        return true;
    }
}
