package org.flutterjs.analyzer.frontend.module;

import org.flutterjs.analyzer.api.FileIdentity;

import java.util.List;

/**
 * Outcome of enumerating the cycles of a {@link DependencyGraph}.
 * Callers decide themselves whether a {@link Cyclic} result is fatal or advisory.
 */
public sealed interface CycleReport permits CycleReport.Acyclic, CycleReport.Cyclic {

    /**
     * @return {@code true} if at least one cycle was found.
     */
    boolean hasCycles();

    /**
     * @return The discovered cycles; empty when acyclic.
     */
    List<List<FileIdentity>> cycles();

    /**
     * The graph has no cycles.
     */
    record Acyclic() implements CycleReport {
        @Override
        public boolean hasCycles() {
            return false;
        }

        @Override
        public List<List<FileIdentity>> cycles() {
            return List.of();
        }
    }

    /**
     * The graph has one or more cycles. Each cycle lists its files in traversal order and
     * repeats the entry file at the end, e.g. {@code [a, b, c, a]}. Overlapping cycles reached
     * from different entry points are all reported.
     *
     * @param cycles The discovered cycles.
     */
    record Cyclic(List<List<FileIdentity>> cycles) implements CycleReport {
        public Cyclic {
            cycles = cycles.stream().map(List::copyOf).toList();
        }

        @Override
        public boolean hasCycles() {
            return true;
        }
    }
}
