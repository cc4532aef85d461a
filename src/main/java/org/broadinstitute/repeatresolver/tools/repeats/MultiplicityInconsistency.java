package org.broadinstitute.repeatresolver.tools.repeats;

import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * A separation that was refused because a repeat edge had fewer copies left than a confirmed path needed.
 * The edge is left UNRESOLVED_RETAINED.
 */
public final class MultiplicityInconsistency {
    private final int iteration;
    private final int edge;
    private final GraphPath path;
    private final int remainingCopies;
    private final int requestedCopies;

    public MultiplicityInconsistency( final int iteration, final int edge, final GraphPath path,
                                      final int remainingCopies, final int requestedCopies ) {
        this.iteration = iteration;
        this.edge = edge;
        this.path = Utils.nonNull(path, "path");
        this.remainingCopies = remainingCopies;
        this.requestedCopies = requestedCopies;
    }

    public int getIteration() { return iteration; }
    public int getEdge() { return edge; }
    public GraphPath getPath() { return path; }
    public int getRemainingCopies() { return remainingCopies; }
    public int getRequestedCopies() { return requestedCopies; }

    @Override public String toString() {
        return "iteration " + iteration + ": path " + path + " needs " + requestedCopies + " copies of e" + edge +
                ", which has " + remainingCopies;
    }
}
