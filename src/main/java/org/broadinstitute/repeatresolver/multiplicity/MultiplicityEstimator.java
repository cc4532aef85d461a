package org.broadinstitute.repeatresolver.multiplicity;

import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;

/**
 * Estimates how many genomic copies an edge stands for.
 */
public interface MultiplicityEstimator {
    MultiplicityEstimate estimate( RepeatGraph graph, GraphEdge edge );
}
