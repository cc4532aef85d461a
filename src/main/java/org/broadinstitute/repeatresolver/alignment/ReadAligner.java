package org.broadinstitute.repeatresolver.alignment;

import org.broadinstitute.repeatresolver.graph.RepeatGraph;

import java.util.List;

/**
 * Source of read-to-graph alignments.
 * The resolver may call {@link #query} from several threads at once while the graph is not being modified.
 */
public interface ReadAligner {

    /**
     * @return every alignment that touches {@code edge}, in a stable order. A read aligned equally well along
     * several paths reports one alignment per path.
     */
    List<ReadAlignment> query( RepeatGraph graph, int edge );

    /**
     * Called after a resolution iteration has rewritten the graph, before the next one starts.
     * Implementations that keep alignments in terms of edge handles can re-project them here.
     */
    default void onGraphRewritten( final RepeatGraph graph ) {}
}
