package org.broadinstitute.repeatresolver.graph;

/**
 * Resolution state of a {@link GraphEdge}.
 */
public enum EdgeState {
    /** a single genomic copy; paths through it need no disambiguation */
    UNIQUE,
    /** a repeat still waiting for read evidence */
    REPEAT_PENDING,
    /** a copy split off a repeat for one confirmed traversal */
    SEPARATED,
    /** a repeat that could neither be resolved nor safely removed; left alone for the rest of the run */
    UNRESOLVED_RETAINED;

    /** true for the states that may bound a repeat traversal */
    public boolean isFlank() {
        return this == UNIQUE || this == SEPARATED;
    }
}
