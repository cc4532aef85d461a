package org.broadinstitute.repeatresolver.tools.repeats;

import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * Evidence from a single read that the genome passes through a repeat along one particular path:
 * the path, flanks included, and the part of the read that spans the repeat.
 * Lives for one resolution iteration only.
 */
public final class Connection {
    private final GraphPath path;
    private final SequenceSegment readSegment;

    public Connection( final GraphPath path, final SequenceSegment readSegment ) {
        this.path = Utils.nonNull(path, "path");
        this.readSegment = Utils.nonNull(readSegment, "readSegment");
    }

    public GraphPath getPath() { return path; }
    public SequenceSegment getReadSegment() { return readSegment; }

    @Override public String toString() {
        return path + " <- " + readSegment;
    }
}
