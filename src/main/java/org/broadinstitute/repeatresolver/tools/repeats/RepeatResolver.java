package org.broadinstitute.repeatresolver.tools.repeats;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.primitives.Bytes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.alignment.ReadAligner;
import org.broadinstitute.repeatresolver.cmdline.argumentcollections.RepeatResolverArgumentCollection;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.multiplicity.MultiplicityEstimator;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.sequence.SequenceStore;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.nio.file.Path;
import java.util.List;

/**
 * Untangles repeats in an assembly graph using long reads that span them.
 *
 * {@link #findRepeats()} marks the edges that may stand for more than one place in the genome.
 * {@link #resolveRepeats()} then repeatedly gathers reads that cross a repeat from one unique edge to another,
 * gives each well supported crossing an edge of its own, and deletes repeat edges nothing supports,
 * until an iteration changes nothing.
 *
 * The graph is rewritten in place.  Only one resolution may run at a time on a given resolver.
 */
public final class RepeatResolver {
    private static final Logger logger = LogManager.getLogger(RepeatResolver.class);

    private final RepeatGraph graph;
    private final SequenceStore assemblySequences;
    private final SequenceStore readSequences;
    private final ReadAligner aligner;
    private final MultiplicityEstimator estimator;
    private final RepeatResolverArgumentCollection args;

    private final ResolutionStatistics statistics = new ResolutionStatistics();
    private final ConnectionExtractor connectionExtractor;
    private final ConnectionResolver connectionResolver;
    private final UnsupportedEdgePruner pruner;
    private boolean resolving = false;

    public RepeatResolver( final RepeatGraph graph,
                           final SequenceStore assemblySequences,
                           final SequenceStore readSequences,
                           final ReadAligner aligner,
                           final MultiplicityEstimator estimator,
                           final RepeatResolverArgumentCollection args ) {
        this.graph = Utils.nonNull(graph, "graph");
        this.assemblySequences = Utils.nonNull(assemblySequences, "assemblySequences");
        this.readSequences = Utils.nonNull(readSequences, "readSequences");
        this.aligner = Utils.nonNull(aligner, "aligner");
        this.estimator = Utils.nonNull(estimator, "estimator");
        this.args = Utils.nonNull(args, "args");
        args.validate();

        connectionExtractor = new ConnectionExtractor(graph, aligner, readSequences, args.extractionThreads);
        connectionResolver = new ConnectionResolver(graph, estimator, args.supportThreshold,
                                                    args.minFlankConfidence, statistics);
        pruner = new UnsupportedEdgePruner(graph, estimator, args.minPruneConfidence, statistics);
    }

    /**
     * Classifies every edge that is still open to resolution as UNIQUE or REPEAT_PENDING.
     * An edge is a repeat if it has more than one copy, if it loops back onto its own junction, or if more than
     * one edge enters its source while more than one edge leaves its target.
     * Copy numbers come from the estimator the first time an edge is seen and are kept from then on.
     * Repeats already resolved in place stay UNIQUE.
     */
    public void findRepeats() {
        int nRepeats = 0;
        int nUnique = 0;
        for ( final GraphEdge edge : graph.getEdges() ) {
            final boolean open = edge.getState() == EdgeState.UNIQUE || edge.getState() == EdgeState.REPEAT_PENDING;
            if ( !open || edge.wasResolvedInPlace() ) {
                continue;
            }
            if ( !edge.isClassified() ) {
                graph.classify(edge.getId(), estimator.estimate(graph, edge).getCopyNumber());
            }
            if ( isRepeat(edge) ) {
                edge.setState(EdgeState.REPEAT_PENDING);
                nRepeats += 1;
            } else {
                edge.setState(EdgeState.UNIQUE);
                nUnique += 1;
            }
        }
        logger.info("Found " + nRepeats + " repeat edges and " + nUnique + " unique edges");
    }

    private boolean isRepeat( final GraphEdge edge ) {
        return edge.getMultiplicity() > 1 ||
                edge.isLoop() ||
                (graph.getNode(edge.getSource()).getInDegree() > 1 && graph.getNode(edge.getTarget()).getOutDegree() > 1);
    }

    /**
     * Runs resolution iterations until one of them neither accepts a path nor deletes an edge, or until the
     * configured maximum number of iterations has run.  Repeats left over keep their REPEAT_PENDING state.
     * @throws ResolverException if called again while a resolution is already running
     */
    public synchronized void resolveRepeats() {
        if ( resolving ) {
            throw new ResolverException("repeat resolution is already running");
        }
        resolving = true;
        try {
            runIterations();
            final Path dumpPath = args.getRepeatsDumpPath();
            if ( dumpPath != null ) {
                new RepeatsDumpWriter(graph, aligner).write(dumpPath);
            }
            logger.info("Repeat resolution finished: " + statistics);
        } finally {
            resolving = false;
        }
    }

    private void runIterations() {
        boolean converged = false;
        int iteration = 0;
        while ( !converged && iteration < args.maxIterations ) {
            iteration += 1;
            statistics.addIteration();

            final List<Connection> connections = connectionExtractor.getConnections();
            statistics.addConnections(connections.size());
            final int nAccepted = connectionResolver.resolveConnections(connections, iteration);
            clearResolvedRepeats();
            final int nRemoved = pruner.removeUnsupportedEdges();

            logger.info("Iteration " + iteration + ": " + connections.size() + " connections, " +
                    nAccepted + " paths accepted, " + nRemoved + " edges removed");
            converged = nAccepted == 0 && nRemoved == 0;
            if ( !converged ) {
                aligner.onGraphRewritten(graph);
            }
        }
        if ( !converged ) {
            statistics.setIterationCapReached();
            logger.warn("Repeat resolution stopped after " + args.maxIterations + " iterations without converging");
        }
    }

    /**
     * Repeat edges whose last copies were claimed in place this iteration become UNIQUE for good, and the
     * per-iteration resolved marks are cleared so the next iteration starts clean.
     */
    @VisibleForTesting
    void clearResolvedRepeats() {
        for ( final GraphEdge edge : graph.getEdges() ) {
            if ( edge.isResolved() ) {
                if ( edge.isRepeatPending() ) {
                    edge.setState(EdgeState.UNIQUE);
                    edge.markResolvedInPlace();
                }
                edge.setResolved(false);
            }
        }
    }

    /** the bases of an edge, pulled from the assembly or the reads depending on where each segment lives */
    public byte[] getEdgeSequence( final int edge ) {
        final List<SequenceSegment> segments = graph.getEdge(edge).getSegments();
        final byte[][] pieces = new byte[segments.size()][];
        for ( int idx = 0; idx != pieces.length; ++idx ) {
            final SequenceSegment segment = segments.get(idx);
            final SequenceStore store = segment.getSequenceId().isRead() ? readSequences : assemblySequences;
            pieces[idx] = store.getSegmentBases(segment);
        }
        return Bytes.concat(pieces);
    }

    /** separations refused because a repeat had fewer copies left than a path needed */
    public List<MultiplicityInconsistency> getInconsistencies() {
        return connectionResolver.getInconsistencies();
    }

    public ResolutionStatistics getStatistics() { return statistics; }

    public RepeatGraph getGraph() { return graph; }
}
