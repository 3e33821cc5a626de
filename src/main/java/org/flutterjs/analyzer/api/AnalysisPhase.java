package org.flutterjs.analyzer.api;

/**
 * States of one analysis run, in the order the phases complete. {@link #ERROR} is reachable
 * from any phase on a fatal failure.
 */
public enum AnalysisPhase {
    IDLE,
    GRAPH_BUILT,
    CHANGES_DETECTED,
    SYMBOLS_RESOLVED,
    IR_GENERATED,
    LINKED,
    CACHE_PERSISTED,
    COMPLETE,
    ERROR
}
