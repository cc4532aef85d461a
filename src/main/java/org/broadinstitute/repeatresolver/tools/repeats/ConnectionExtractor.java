package org.broadinstitute.repeatresolver.tools.repeats;

import com.google.common.annotations.VisibleForTesting;
import it.unimi.dsi.fastutil.ints.IntList;
import org.apache.commons.lang3.tuple.ImmutablePair;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.alignment.ReadAligner;
import org.broadinstitute.repeatresolver.alignment.ReadAlignment;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.sequence.SequenceId;
import org.broadinstitute.repeatresolver.sequence.SequenceStore;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns read alignments into {@link Connection}s: reads that enter a repeat from one flanking edge, pass through
 * nothing but pending repeat edges, and leave by another flanking edge.
 * Partial spans, stale paths and reads that align equally well along more than one path through an edge give no
 * evidence about which path is real, so they are dropped.
 */
public final class ConnectionExtractor {
    private static final Logger logger = LogManager.getLogger(ConnectionExtractor.class);

    private final RepeatGraph graph;
    private final ReadAligner aligner;
    private final SequenceStore readSequences;
    private final int nThreads;

    public ConnectionExtractor( final RepeatGraph graph, final ReadAligner aligner,
                                final SequenceStore readSequences, final int nThreads ) {
        this.graph = Utils.nonNull(graph, "graph");
        this.aligner = Utils.nonNull(aligner, "aligner");
        this.readSequences = Utils.nonNull(readSequences, "readSequences");
        Utils.validateArg(nThreads >= 1, "nThreads must be at least 1");
        this.nThreads = nThreads;
    }

    /**
     * Collects connections through every pending repeat edge.
     * Edges are queried in handle order, possibly in parallel, and results are concatenated in that order once
     * all queries have finished, so the discovery order does not depend on thread scheduling.
     * A read that spans several edges of the same path is reported once for that path.
     */
    public List<Connection> getConnections() {
        final IntList repeats = graph.getEdgeHandles(EdgeState.REPEAT_PENDING);
        final List<List<Connection>> connectionsPerEdge =
                Utils.transformParallel(repeats, this::connectionsThroughEdge, nThreads, "connection-extractor-%d");

        final List<Connection> connections = new ArrayList<>();
        final Set<Pair<SequenceId, GraphPath>> seen = new HashSet<>();
        for ( final List<Connection> edgeConnections : connectionsPerEdge ) {
            for ( final Connection connection : edgeConnections ) {
                if ( seen.add(new ImmutablePair<>(connection.getReadSegment().getSequenceId(), connection.getPath())) ) {
                    connections.add(connection);
                }
            }
        }
        logger.debug("Found " + connections.size() + " connections through " + repeats.size() + " repeat edges");
        return connections;
    }

    @VisibleForTesting
    List<Connection> connectionsThroughEdge( final int edge ) {
        final Map<SequenceId, List<ReadAlignment>> alignmentsByRead = new LinkedHashMap<>();
        for ( final ReadAlignment alignment : aligner.query(graph, edge) ) {
            if ( alignment.getPath().contains(edge) ) {
                alignmentsByRead.computeIfAbsent(alignment.getReadId(), id -> new ArrayList<>(1)).add(alignment);
            }
        }

        final List<Connection> connections = new ArrayList<>(alignmentsByRead.size());
        for ( final List<ReadAlignment> readAlignments : alignmentsByRead.values() ) {
            final ReadAlignment alignment = readAlignments.get(0);
            if ( isAmbiguous(readAlignments) ) {
                logger.debug("Skipping " + alignment.getReadId() + ": ambiguous alignment through e" + edge);
                continue;
            }
            if ( !isSpanning(alignment) ) {
                continue;
            }
            connections.add(new Connection(alignment.getPath(), alignment.getSpanSegment()));
        }
        return connections;
    }

    private static boolean isAmbiguous( final List<ReadAlignment> readAlignments ) {
        final GraphPath path = readAlignments.get(0).getPath();
        for ( final ReadAlignment alignment : readAlignments ) {
            if ( !alignment.getPath().equals(path) ) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if the alignment runs from one flanking edge, through pending repeat edges only, into a different
     * flanking edge, along edges that are adjacent in the current graph, and its span lies within the read.
     */
    @VisibleForTesting
    boolean isSpanning( final ReadAlignment alignment ) {
        final GraphPath path = alignment.getPath();
        if ( path.size() < 3 || path.getFirst() == path.getLast() || !graph.isContiguous(path) ) {
            return false;
        }
        if ( !graph.getEdge(path.getFirst()).getState().isFlank() ||
                !graph.getEdge(path.getLast()).getState().isFlank() ) {
            return false;
        }
        for ( final int edge : path.getInnerEdges() ) {
            final GraphEdge graphEdge = graph.getEdge(edge);
            if ( !graphEdge.isRepeatPending() ) {
                return false;
            }
        }
        final SequenceId readId = alignment.getReadId();
        return alignment.getSpanStart() >= 0 &&
                alignment.getSpanEnd() > alignment.getSpanStart() &&
                readSequences.contains(readId) &&
                alignment.getSpanEnd() <= readSequences.getLength(readId);
    }
}
