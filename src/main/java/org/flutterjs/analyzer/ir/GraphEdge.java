package org.flutterjs.analyzer.ir;

/**
 * A typed, directed edge of the {@link ComponentGraph}.
 *
 * @param from  Source node id.
 * @param to    Target node id.
 * @param kind  The relationship.
 * @param label Short human-readable description.
 */
public record GraphEdge(String from, String to, Kind kind, String label) {

    public enum Kind {
        /** A stateful component owns a state holder. */
        HAS_STATE,
        /** A component renders another component as a child. */
        COMPOSES,
        /** A component or state holder reads or observes an observable state holder. */
        DEPENDS_ON
    }
}
