package org.broadinstitute.repeatresolver.tools.repeats;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;

/**
 * Rewrites the graph so that one confirmed traversal of a repeat gets an edge of its own.
 *
 * The entry flank is detached onto a new junction, the exit flank likewise, and a single SEPARATED edge
 * carrying the spanning read segment joins the two.  Each inner repeat edge gives up the copies the path uses.
 * When the path uses up every remaining copy of every inner edge there is nothing to fork, and the inner edges
 * are simply marked resolved where they are.
 */
public final class PathSeparator {
    private final RepeatGraph graph;

    public PathSeparator( final RepeatGraph graph ) {
        this.graph = Utils.nonNull(graph, "graph");
    }

    /**
     * Separates a path whose inner edges are all REPEAT_PENDING.
     * Nothing is changed if an inner edge has fewer copies left than the path uses.
     * @return the handle of the new separated edge, or {@link RepeatGraph#NO_HANDLE} if the inner edges were
     *         resolved in place
     * @throws ResolverException.MultiplicityInconsistencyException for the first inner edge short of copies
     */
    public int separate( final GraphPath path, final SequenceSegment readSegment ) {
        Utils.nonNull(path, "path");
        Utils.nonNull(readSegment, "readSegment");
        Utils.validateArg(path.size() >= 3, () -> "path " + path + " has no inner edges");
        Utils.validateArg(graph.isContiguous(path), () -> "path " + path + " is not contiguous");
        for ( final int edge : path.getInnerEdgeCounts().keySet() ) {
            Utils.validateArg(graph.getEdge(edge).isRepeatPending(),
                    () -> "inner edge " + graph.getEdge(edge) + " is no longer open to resolution");
        }

        final Int2IntMap copiesUsed = path.getInnerEdgeCounts();
        boolean lastCopies = true;
        for ( final Int2IntMap.Entry entry : copiesUsed.int2IntEntrySet() ) {
            final int remaining = remainingCopies(graph.getEdge(entry.getIntKey()));
            if ( remaining < entry.getIntValue() ) {
                throw new ResolverException.MultiplicityInconsistencyException(entry.getIntKey(), remaining,
                                                                              entry.getIntValue());
            }
            if ( remaining != entry.getIntValue() ) {
                lastCopies = false;
            }
        }

        if ( lastCopies ) {
            for ( final int edge : copiesUsed.keySet() ) {
                graph.getEdge(edge).setResolved(true);
            }
            return RepeatGraph.NO_HANDLE;
        }

        final int entryFlank = path.getFirst();
        final int exitFlank = path.getLast();
        final IntSet touchedJunctions = new IntLinkedOpenHashSet();
        touchedJunctions.add(graph.getEdge(entryFlank).getTarget());
        touchedJunctions.add(graph.getEdge(exitFlank).getSource());

        final int leftJunction = graph.addNode();
        graph.moveEdgeTarget(entryFlank, leftJunction);
        final int rightJunction = graph.addNode();
        graph.moveEdgeSource(exitFlank, rightJunction);
        final int separatedEdge =
                graph.addSeparatedEdge(leftJunction, rightJunction, readSegment, new IntArrayList(path.getInnerEdges()));

        for ( final Int2IntMap.Entry entry : copiesUsed.int2IntEntrySet() ) {
            final GraphEdge innerEdge = graph.getEdge(entry.getIntKey());
            touchedJunctions.add(innerEdge.getSource());
            touchedJunctions.add(innerEdge.getTarget());
            graph.grantCopies(entry.getIntKey(), entry.getIntValue());
        }

        // junctions that only served copies now owned by the separated edge
        for ( final int junction : touchedJunctions ) {
            if ( graph.containsNode(junction) && graph.getNode(junction).isIsolated() ) {
                graph.removeNode(junction);
            }
        }
        return separatedEdge;
    }

    /** copies of an edge still available; an edge already resolved in place has none */
    static int remainingCopies( final GraphEdge edge ) {
        return edge.isResolved() ? 0 : edge.getMultiplicity();
    }
}
