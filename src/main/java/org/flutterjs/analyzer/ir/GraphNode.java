package org.flutterjs.analyzer.ir;

/**
 * A node of the {@link ComponentGraph}; its id equals the declaration id.
 */
public record GraphNode(String id, String name, Kind kind) {

    public enum Kind { COMPONENT, STATE_HOLDER, OBSERVABLE_STATE }
}
