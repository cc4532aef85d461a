package org.broadinstitute.repeatresolver.tools.repeats;

import com.google.common.annotations.VisibleForTesting;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.multiplicity.MultiplicityEstimator;
import org.broadinstitute.repeatresolver.utils.Utils;
import org.broadinstitute.repeatresolver.utils.param.ParamUtils;

/**
 * Deletes repeat edges that no read has ever confirmed and that the multiplicity estimator has little faith in.
 * An edge is only deleted when both of its junctions keep another edge in the same direction;
 * otherwise it is kept and marked UNRESOLVED_RETAINED.
 */
public final class UnsupportedEdgePruner {
    private static final Logger logger = LogManager.getLogger(UnsupportedEdgePruner.class);

    private final RepeatGraph graph;
    private final MultiplicityEstimator estimator;
    private final double minConfidence;
    private final ResolutionStatistics statistics;

    public UnsupportedEdgePruner( final RepeatGraph graph, final MultiplicityEstimator estimator,
                                  final double minConfidence, final ResolutionStatistics statistics ) {
        this.graph = Utils.nonNull(graph, "graph");
        this.estimator = Utils.nonNull(estimator, "estimator");
        this.minConfidence = ParamUtils.inRange(minConfidence, 0.0, 1.0, "minimum confidence must lie in [0, 1]");
        this.statistics = Utils.nonNull(statistics, "statistics");
    }

    /** @return the number of edges deleted */
    public int removeUnsupportedEdges() {
        int nRemoved = 0;
        for ( final int edge : graph.getEdgeHandles(EdgeState.REPEAT_PENDING) ) {
            final GraphEdge graphEdge = graph.getEdge(edge);
            if ( graphEdge.getSupport() > 0 ) {
                continue;
            }
            final double confidence = estimator.estimate(graph, graphEdge).getConfidence();
            if ( confidence >= minConfidence ) {
                continue;
            }
            if ( isSafeToRemove(graph, graphEdge) ) {
                logger.debug("Pruning unsupported edge " + graphEdge + " with confidence " + confidence);
                graph.pruneEdge(edge);
                nRemoved += 1;
            } else {
                logger.debug("Retaining unsupported edge " + graphEdge + ": its removal would strand a junction");
                graphEdge.setState(EdgeState.UNRESOLVED_RETAINED);
                statistics.addRetained();
            }
        }
        statistics.addPruned(nRemoved);
        return nRemoved;
    }

    /**
     * True if the edge's source has another way out and its target has another way in, so that no junction loses
     * its last edge and no walk through the graph is cut.
     */
    @VisibleForTesting
    static boolean isSafeToRemove( final RepeatGraph graph, final GraphEdge edge ) {
        return graph.getNode(edge.getSource()).getOutDegree() > 1 &&
                graph.getNode(edge.getTarget()).getInDegree() > 1;
    }
}
