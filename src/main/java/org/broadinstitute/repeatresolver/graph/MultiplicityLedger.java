package org.broadinstitute.repeatresolver.graph;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * Bookkeeping of copy numbers for every classified edge.
 * Entries outlive the edges they describe, so copies handed to separated edges can still be accounted for after the
 * original edge has been used up and deleted.
 */
public final class MultiplicityLedger {
    private final Int2IntOpenHashMap originalMultiplicity = new Int2IntOpenHashMap();
    private final Int2IntOpenHashMap grantedCopies = new Int2IntOpenHashMap();
    private final IntSet pruned = new IntOpenHashSet();

    MultiplicityLedger() {}

    void register( final int edge, final int multiplicity ) {
        Utils.validateArg(multiplicity >= 1, "multiplicity must be positive");
        originalMultiplicity.putIfAbsent(edge, multiplicity);
    }

    public boolean isRegistered( final int edge ) {
        return originalMultiplicity.containsKey(edge);
    }

    public int getOriginalMultiplicity( final int edge ) {
        Utils.validateArg(isRegistered(edge), () -> "edge " + edge + " was never classified");
        return originalMultiplicity.get(edge);
    }

    /** copies of the edge that now live in separated edges */
    public int getGrantedCopies( final int edge ) {
        return grantedCopies.get(edge);
    }

    void recordGrant( final int edge, final int copies ) {
        Utils.validateArg(copies > 0, "must grant at least one copy");
        Utils.validate(getGrantedCopies(edge) + copies <= getOriginalMultiplicity(edge),
                () -> "edge " + edge + " granted more copies than it ever had");
        grantedCopies.addTo(edge, copies);
    }

    void recordPruned( final int edge ) {
        pruned.add(edge);
    }

    /** true if the edge was deleted for lack of support; its copies are not accounted for */
    public boolean wasPruned( final int edge ) {
        return pruned.contains(edge);
    }
}
