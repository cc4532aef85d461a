package org.broadinstitute.repeatresolver.sequence;

import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * A half-open interval [start, end) of a sequence in a {@link SequenceStore}, on either strand.
 * Segments only refer to sequence, they never copy it.
 */
public final class SequenceSegment {
    private final SequenceId sequenceId;
    private final int start;
    private final int end;
    private final boolean negativeStrand;

    public SequenceSegment( final SequenceId sequenceId, final int start, final int end ) {
        this(sequenceId, start, end, false);
    }

    public SequenceSegment( final SequenceId sequenceId, final int start, final int end, final boolean negativeStrand ) {
        Utils.nonNull(sequenceId, "sequenceId");
        Utils.validateArg(start >= 0, () -> "negative segment start " + start);
        Utils.validateArg(end >= start, () -> "segment end " + end + " precedes start " + start);
        this.sequenceId = sequenceId;
        this.start = start;
        this.end = end;
        this.negativeStrand = negativeStrand;
    }

    public SequenceId getSequenceId() { return sequenceId; }
    public int getStart() { return start; }
    public int getEnd() { return end; }
    public int length() { return end - start; }
    public boolean isNegativeStrand() { return negativeStrand; }

    /** true if the segment lies within a sequence of the given length */
    public boolean fitsWithin( final int sequenceLength ) {
        return end <= sequenceLength;
    }

    @Override public boolean equals( final Object obj ) {
        if ( this == obj ) return true;
        if ( !(obj instanceof SequenceSegment) ) return false;
        final SequenceSegment that = (SequenceSegment)obj;
        return start == that.start && end == that.end && negativeStrand == that.negativeStrand &&
                sequenceId.equals(that.sequenceId);
    }

    @Override public int hashCode() {
        return 47 * (47 * (47 * sequenceId.hashCode() + start) + end) + (negativeStrand ? 1 : 0);
    }

    @Override public String toString() {
        return sequenceId + ":" + start + "-" + end + (negativeStrand ? "(-)" : "(+)");
    }
}
