package org.broadinstitute.repeatresolver.graph;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A directed multigraph of junctions and sequence edges, stored as two arenas addressed by integer handles.
 * Handles are never reused: a deleted element leaves an empty slot, so handles held elsewhere stay meaningful.
 * Every topology change updates the edge and the adjacency lists of the junctions it touches together.
 *
 * Not thread-safe. Concurrent readers are fine while nobody mutates the graph.
 */
public final class RepeatGraph {
    public static final int NO_HANDLE = -1;

    private final List<GraphNode> nodes = new ArrayList<>();
    private final List<GraphEdge> edges = new ArrayList<>();
    private final MultiplicityLedger ledger = new MultiplicityLedger();
    private int nLiveNodes;
    private int nLiveEdges;

    public int addNode() {
        final int id = nodes.size();
        nodes.add(new GraphNode(id));
        nLiveNodes += 1;
        return id;
    }

    /** adds an assembled edge, initially unclassified and {@link EdgeState#UNIQUE} */
    public int addEdge( final int source, final int target, final int length,
                        final List<SequenceSegment> segments ) {
        Utils.nonEmpty(segments, "an assembled edge needs content");
        Utils.containsNoNull(segments, "null segment");
        return addEdge(source, target, length, segments, IntLists.EMPTY_LIST, EdgeState.UNIQUE);
    }

    /**
     * Adds an edge holding one separated copy of the repeat edges in {@code lineage}.
     * Its content is {@code segment}, its multiplicity 1 and its state {@link EdgeState#SEPARATED}.
     */
    public int addSeparatedEdge( final int source, final int target, final SequenceSegment segment,
                                 final IntList lineage ) {
        Utils.nonNull(segment, "segment");
        Utils.validateArg(!lineage.isEmpty(), "a separated edge must descend from at least one repeat edge");
        final int edge = addEdge(source, target, segment.length(), Collections.singletonList(segment),
                lineage, EdgeState.SEPARATED);
        getEdge(edge).setClassified();
        return edge;
    }

    private int addEdge( final int source, final int target, final int length,
                         final List<SequenceSegment> segments, final IntList lineage, final EdgeState state ) {
        Utils.nonNull(segments, "segments");
        final GraphNode sourceNode = getNode(source);
        final GraphNode targetNode = getNode(target);
        final int id = edges.size();
        edges.add(new GraphEdge(id, source, target, length, segments, lineage, state));
        sourceNode.addOutEdge(id);
        targetNode.addInEdge(id);
        nLiveEdges += 1;
        return id;
    }

    public boolean containsNode( final int node ) {
        return node >= 0 && node < nodes.size() && nodes.get(node) != null;
    }

    public boolean containsEdge( final int edge ) {
        return edge >= 0 && edge < edges.size() && edges.get(edge) != null;
    }

    public GraphNode getNode( final int node ) {
        if ( !containsNode(node) ) {
            throw new ResolverException.MissingGraphElement("junction", node);
        }
        return nodes.get(node);
    }

    public GraphEdge getEdge( final int edge ) {
        if ( !containsEdge(edge) ) {
            throw new ResolverException.MissingGraphElement("edge", edge);
        }
        return edges.get(edge);
    }

    /** live edges in handle order */
    public List<GraphEdge> getEdges() {
        return edges.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    /** live junctions in handle order */
    public List<GraphNode> getNodes() {
        return nodes.stream().filter(Objects::nonNull).collect(Collectors.toList());
    }

    public IntList getEdgeHandles( final EdgeState state ) {
        final IntArrayList result = new IntArrayList();
        for ( final GraphEdge edge : edges ) {
            if ( edge != null && edge.getState() == state ) {
                result.add(edge.getId());
            }
        }
        return result;
    }

    public int getNodeCount() { return nLiveNodes; }
    public int getEdgeCount() { return nLiveEdges; }

    public MultiplicityLedger getLedger() { return ledger; }

    /** records the copy number an edge had when it was first classified */
    public void classify( final int edge, final int multiplicity ) {
        final GraphEdge graphEdge = getEdge(edge);
        graphEdge.setMultiplicity(multiplicity);
        graphEdge.setClassified();
        ledger.register(edge, multiplicity);
    }

    /**
     * Takes {@code copies} copies away from a repeat edge on behalf of a separated edge.
     * An edge left with no copies is deleted.
     * @return true if the edge was used up and deleted
     */
    public boolean grantCopies( final int edge, final int copies ) {
        final GraphEdge graphEdge = getEdge(edge);
        final int remaining = graphEdge.getMultiplicity() - copies;
        if ( remaining < 0 ) {
            throw new ResolverException.MultiplicityInconsistencyException(edge, graphEdge.getMultiplicity(), copies);
        }
        ledger.recordGrant(edge, copies);
        if ( remaining == 0 ) {
            removeEdge(edge);
            return true;
        }
        graphEdge.setMultiplicity(remaining);
        return false;
    }

    /** deletes an edge that lost all support; it is recorded as pruned in the ledger */
    public void pruneEdge( final int edge ) {
        removeEdge(edge);
        ledger.recordPruned(edge);
    }

    /** detaches an edge from its junctions and frees its slot; the junctions stay */
    public void removeEdge( final int edge ) {
        final GraphEdge graphEdge = getEdge(edge);
        if ( !getNode(graphEdge.getSource()).removeOutEdge(edge) ) {
            throw new ResolverException("failed to find edge " + edge + " among its source's out-edges");
        }
        if ( !getNode(graphEdge.getTarget()).removeInEdge(edge) ) {
            throw new ResolverException("failed to find edge " + edge + " among its target's in-edges");
        }
        edges.set(edge, null);
        nLiveEdges -= 1;
    }

    /** deletes a junction, which must no longer have any edges */
    public void removeNode( final int node ) {
        final GraphNode graphNode = getNode(node);
        if ( !graphNode.isIsolated() ) {
            throw new ResolverException("junction " + node + " still has edges");
        }
        nodes.set(node, null);
        nLiveNodes -= 1;
    }

    /** re-points the end of an edge at a different junction */
    public void moveEdgeTarget( final int edge, final int newTarget ) {
        final GraphEdge graphEdge = getEdge(edge);
        final GraphNode newTargetNode = getNode(newTarget);
        if ( !getNode(graphEdge.getTarget()).removeInEdge(edge) ) {
            throw new ResolverException("failed to find edge " + edge + " among its target's in-edges");
        }
        graphEdge.setTarget(newTarget);
        newTargetNode.addInEdge(edge);
    }

    /** re-points the start of an edge at a different junction */
    public void moveEdgeSource( final int edge, final int newSource ) {
        final GraphEdge graphEdge = getEdge(edge);
        final GraphNode newSourceNode = getNode(newSource);
        if ( !getNode(graphEdge.getSource()).removeOutEdge(edge) ) {
            throw new ResolverException("failed to find edge " + edge + " among its source's out-edges");
        }
        graphEdge.setSource(newSource);
        newSourceNode.addOutEdge(edge);
    }

    /** true if every edge of the path is live and each one ends where the next begins */
    public boolean isContiguous( final GraphPath path ) {
        final IntList pathEdges = path.getEdges();
        for ( int idx = 0; idx != pathEdges.size(); ++idx ) {
            if ( !containsEdge(pathEdges.getInt(idx)) ) {
                return false;
            }
            if ( idx > 0 &&
                    getEdge(pathEdges.getInt(idx - 1)).getTarget() != getEdge(pathEdges.getInt(idx)).getSource() ) {
                return false;
            }
        }
        return true;
    }

    /**
     * Breadth-first search for a path with the fewest edges leading out of {@code fromNode} and into {@code toNode}.
     * Ties go to the edge with the lower handle.
     * @return the path, or null if {@code toNode} cannot be reached
     */
    public GraphPath shortestPath( final int fromNode, final int toNode ) {
        getNode(fromNode);
        getNode(toNode);
        final Int2IntOpenHashMap arrivedBy = new Int2IntOpenHashMap();
        arrivedBy.defaultReturnValue(NO_HANDLE);
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(fromNode);
        while ( !queue.isEmpty() && !arrivedBy.containsKey(toNode) ) {
            final int[] outEdges = getNode(queue.dequeueInt()).getOutEdges().toIntArray();
            Arrays.sort(outEdges);
            for ( final int edge : outEdges ) {
                final int next = getEdge(edge).getTarget();
                if ( !arrivedBy.containsKey(next) ) {
                    arrivedBy.put(next, edge);
                    queue.enqueue(next);
                }
            }
        }
        if ( !arrivedBy.containsKey(toNode) ) {
            return null;
        }
        // walk the search tree back to the start
        final IntArrayList pathEdges = new IntArrayList();
        int node = toNode;
        do {
            final int edge = arrivedBy.get(node);
            pathEdges.add(edge);
            node = getEdge(edge).getSource();
        } while ( node != fromNode );
        Collections.reverse(pathEdges);
        return new GraphPath(pathEdges);
    }

    /** how many copies of an original edge the live separated edges carry */
    public int countSeparatedCopies( final int originalEdge ) {
        int count = 0;
        for ( final GraphEdge edge : edges ) {
            if ( edge != null && edge.getState() == EdgeState.SEPARATED ) {
                for ( final int ancestor : edge.getLineage() ) {
                    if ( ancestor == originalEdge ) {
                        count += 1;
                    }
                }
            }
        }
        return count;
    }

    @Override public String toString() {
        return "RepeatGraph(" + nLiveNodes + " junctions, " + nLiveEdges + " edges)";
    }
}
