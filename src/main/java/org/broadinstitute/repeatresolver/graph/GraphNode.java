package org.broadinstitute.repeatresolver.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * A junction. Holds nothing but the handles of its incoming and outgoing edges.
 * A self-loop appears once in each list.
 */
public final class GraphNode {
    private final int id;
    private final IntArrayList inEdges = new IntArrayList(2);
    private final IntArrayList outEdges = new IntArrayList(2);

    GraphNode( final int id ) {
        this.id = id;
    }

    public int getId() { return id; }
    public IntList getInEdges() { return IntLists.unmodifiable(inEdges); }
    public IntList getOutEdges() { return IntLists.unmodifiable(outEdges); }
    public int getInDegree() { return inEdges.size(); }
    public int getOutDegree() { return outEdges.size(); }
    public int getDegree() { return inEdges.size() + outEdges.size(); }
    public boolean isIsolated() { return inEdges.isEmpty() && outEdges.isEmpty(); }

    void addInEdge( final int edge ) { inEdges.add(edge); }
    void addOutEdge( final int edge ) { outEdges.add(edge); }
    boolean removeInEdge( final int edge ) { return inEdges.rem(edge); }
    boolean removeOutEdge( final int edge ) { return outEdges.rem(edge); }

    @Override public String toString() {
        return "n" + id + "(in=" + inEdges + " out=" + outEdges + ")";
    }
}
