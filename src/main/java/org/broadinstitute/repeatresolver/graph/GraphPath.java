package org.broadinstitute.repeatresolver.graph;

import it.unimi.dsi.fastutil.ints.Int2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.util.stream.Collectors;

/**
 * An ordered list of edge handles.
 * When it describes a traversal of a repeat, the first and last edges are the flanks through which the traversal
 * enters and leaves, and the edges in between are the repeat copies it passes through.
 * Immutable, so the hashCode is computed lazily and kept.
 */
public final class GraphPath {
    private final IntList edges;
    private int hashCode;

    public GraphPath( final IntList edges ) {
        Utils.nonNull(edges, "edges");
        Utils.validateArg(!edges.isEmpty(), "empty path");
        this.edges = IntLists.unmodifiable(new IntArrayList(edges));
    }

    public static GraphPath of( final int... edges ) {
        return new GraphPath(IntArrayList.wrap(edges));
    }

    public IntList getEdges() { return edges; }
    public int size() { return edges.size(); }
    public int get( final int idx ) { return edges.getInt(idx); }
    public int getFirst() { return edges.getInt(0); }
    public int getLast() { return edges.getInt(edges.size() - 1); }
    public boolean contains( final int edge ) { return edges.contains(edge); }

    /** the edges strictly between the first and the last */
    public IntList getInnerEdges() {
        return edges.size() <= 2 ? IntLists.EMPTY_LIST : edges.subList(1, edges.size() - 1);
    }

    /**
     * How many times each inner edge is traversed, keyed in order of first traversal.
     * A repeat traversed twice by one path needs two of its copies.
     */
    public Int2IntMap getInnerEdgeCounts() {
        final Int2IntLinkedOpenHashMap counts = new Int2IntLinkedOpenHashMap();
        for ( final int edge : getInnerEdges() ) {
            counts.addTo(edge, 1);
        }
        return counts;
    }

    @Override public boolean equals( final Object obj ) {
        if ( this == obj ) return true;
        if ( !(obj instanceof GraphPath) ) return false;
        final GraphPath that = (GraphPath)obj;
        return hashCode() == that.hashCode() && edges.equals(that.edges);
    }

    @Override public int hashCode() {
        if ( hashCode == 0 ) {
            hashCode = edges.hashCode();
        }
        return hashCode;
    }

    @Override public String toString() {
        return edges.intStream().mapToObj(edge -> "e" + edge).collect(Collectors.joining("->"));
    }
}
