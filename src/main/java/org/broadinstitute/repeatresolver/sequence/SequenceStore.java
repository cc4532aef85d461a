package org.broadinstitute.repeatresolver.sequence;

import htsjdk.samtools.util.SequenceUtil;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;

import java.util.Arrays;
import java.util.Collection;

/**
 * Read-only lookup of sequence content by identifier.
 * Implementations must be safe for concurrent reads.
 */
public interface SequenceStore {

    boolean contains( SequenceId id );

    /**
     * @return the bases of the named sequence; callers must not modify the returned array
     * @throws ResolverException.ShouldNeverReachHereException if the store does not hold the sequence
     */
    byte[] getSequence( SequenceId id );

    int getLength( SequenceId id );

    Collection<SequenceId> getIds();

    /**
     * Copies out the bases of a segment, reverse-complemented when the segment lies on the negative strand.
     */
    default byte[] getSegmentBases( final SequenceSegment segment ) {
        final byte[] sequence = getSequence(segment.getSequenceId());
        if ( !segment.fitsWithin(sequence.length) ) {
            throw new ResolverException("segment " + segment + " runs past the end of a sequence of length " +
                    sequence.length);
        }
        final byte[] bases = Arrays.copyOfRange(sequence, segment.getStart(), segment.getEnd());
        if ( segment.isNegativeStrand() ) {
            SequenceUtil.reverseComplement(bases);
        }
        return bases;
    }
}
