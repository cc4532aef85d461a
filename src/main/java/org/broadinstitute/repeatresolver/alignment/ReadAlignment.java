package org.broadinstitute.repeatresolver.alignment;

import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.sequence.SequenceId;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * One read's chain of alignments to consecutive graph edges.
 * {@code spanStart} and {@code spanEnd} are read coordinates of the part of the read that lies between the end of
 * the first edge of the path and the start of its last edge.
 */
public final class ReadAlignment {
    private final SequenceId readId;
    private final GraphPath path;
    private final int spanStart;
    private final int spanEnd;
    private final boolean negativeStrand;

    public ReadAlignment( final SequenceId readId, final GraphPath path,
                          final int spanStart, final int spanEnd, final boolean negativeStrand ) {
        this.readId = Utils.nonNull(readId, "readId");
        this.path = Utils.nonNull(path, "path");
        Utils.validateArg(readId.isRead(), () -> readId + " does not name a read");
        this.spanStart = spanStart;
        this.spanEnd = spanEnd;
        this.negativeStrand = negativeStrand;
    }

    public ReadAlignment( final SequenceId readId, final GraphPath path, final int spanStart, final int spanEnd ) {
        this(readId, path, spanStart, spanEnd, false);
    }

    public SequenceId getReadId() { return readId; }
    public GraphPath getPath() { return path; }
    public int getSpanStart() { return spanStart; }
    public int getSpanEnd() { return spanEnd; }
    public boolean isNegativeStrand() { return negativeStrand; }

    /** the spanned part of the read as a segment; only valid when the span is well formed */
    public SequenceSegment getSpanSegment() {
        return new SequenceSegment(readId, spanStart, spanEnd, negativeStrand);
    }

    @Override public String toString() {
        return readId.getName() + "[" + spanStart + "," + spanEnd + ")" + (negativeStrand ? "-" : "+") + " " + path;
    }
}
