package org.broadinstitute.repeatresolver.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;
import org.broadinstitute.repeatresolver.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A sequence segment of the assembly, running from its source junction to its target junction.
 * Endpoints are changed only through {@link RepeatGraph}, which keeps the junctions' adjacency lists in step.
 */
public final class GraphEdge {
    private final int id;
    private int source;
    private int target;
    private final int length;
    private final List<SequenceSegment> segments;
    private final IntList lineage;
    private int multiplicity;
    private EdgeState state;
    private int support;
    private boolean classified;
    private boolean resolved;
    private boolean resolvedInPlace;

    GraphEdge( final int id, final int source, final int target, final int length,
               final List<SequenceSegment> segments, final IntList lineage, final EdgeState state ) {
        this.id = id;
        this.source = source;
        this.target = target;
        this.length = ParamUtils.isPositiveOrZero(length, "negative edge length");
        this.segments = Collections.unmodifiableList(new ArrayList<>(segments));
        this.lineage = IntLists.unmodifiable(new IntArrayList(lineage));
        this.multiplicity = 1;
        this.state = state;
    }

    public int getId() { return id; }
    public int getSource() { return source; }
    public int getTarget() { return target; }
    public int getLength() { return length; }
    public boolean isLoop() { return source == target; }

    /** the sequence content of the edge, in order */
    public List<SequenceSegment> getSegments() { return segments; }

    /** for a separated copy, the repeat edges it was split from (one entry per copy taken); empty otherwise */
    public IntList getLineage() { return lineage; }

    public int getMultiplicity() { return multiplicity; }
    public void setMultiplicity( final int multiplicity ) {
        Utils.validateArg(multiplicity >= 1, () -> "multiplicity of edge " + id + " must be at least 1, not " + multiplicity);
        this.multiplicity = multiplicity;
    }

    public EdgeState getState() { return state; }
    public void setState( final EdgeState state ) { this.state = Utils.nonNull(state, "state"); }
    public boolean isRepeatPending() { return state == EdgeState.REPEAT_PENDING; }

    /** number of read connections that have traversed this edge, over all iterations */
    public int getSupport() { return support; }
    public void addSupport( final int count ) {
        Utils.validateArg(count >= 0, "support only accumulates");
        support += count;
    }

    /** whether repeat detection has already assigned this edge a multiplicity */
    public boolean isClassified() { return classified; }
    void setClassified() { classified = true; }

    /** set when the edge was resolved in place during the current iteration */
    public boolean isResolved() { return resolved; }
    public void setResolved( final boolean resolved ) { this.resolved = resolved; }

    /** set for good once a repeat's last copies were claimed where it stands; detection leaves such edges alone */
    public boolean wasResolvedInPlace() { return resolvedInPlace; }
    public void markResolvedInPlace() { resolvedInPlace = true; }

    void setSource( final int source ) { this.source = source; }
    void setTarget( final int target ) { this.target = target; }

    @Override public String toString() {
        return "e" + id + "(" + source + "->" + target + " " + state + " x" + multiplicity + ")";
    }
}
