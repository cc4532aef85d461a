package org.broadinstitute.repeatresolver.tools.repeats;

import com.google.common.annotations.VisibleForTesting;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.exceptions.ResolverException;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.multiplicity.MultiplicityEstimator;
import org.broadinstitute.repeatresolver.sequence.SequenceSegment;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Scores connections by the path they confirm and separates the paths that have enough support.
 *
 * Paths compete for the copies of the repeat edges they traverse, and for the flanking edges they are attached to.
 * Acceptable paths are taken greedily, best supported first, ties going to the path discovered first.
 * A path that loses the competition is simply left alone: it may win in a later iteration.
 */
public final class ConnectionResolver {
    private static final Logger logger = LogManager.getLogger(ConnectionResolver.class);

    private final RepeatGraph graph;
    private final MultiplicityEstimator estimator;
    private final PathSeparator separator;
    private final Integer supportThresholdOverride;
    private final double minFlankConfidence;
    private final ResolutionStatistics statistics;
    private final List<MultiplicityInconsistency> inconsistencies = new ArrayList<>();

    public ConnectionResolver( final RepeatGraph graph,
                               final MultiplicityEstimator estimator,
                               final Integer supportThresholdOverride,
                               final double minFlankConfidence,
                               final ResolutionStatistics statistics ) {
        this.graph = Utils.nonNull(graph, "graph");
        this.estimator = Utils.nonNull(estimator, "estimator");
        Utils.validateArg(supportThresholdOverride == null || supportThresholdOverride >= 1,
                "support threshold must be positive");
        Utils.validateArg(minFlankConfidence >= 0.0, "minimum flank confidence must not be negative");
        this.separator = new PathSeparator(graph);
        this.supportThresholdOverride = supportThresholdOverride;
        this.minFlankConfidence = minFlankConfidence;
        this.statistics = Utils.nonNull(statistics, "statistics");
    }

    /** every separation refused so far, in the order they happened */
    public List<MultiplicityInconsistency> getInconsistencies() {
        return Collections.unmodifiableList(inconsistencies);
    }

    /**
     * Groups one iteration's connections by path, credits the repeat edges they traverse with support, and separates
     * every acceptable path that does not conflict with a better one.
     * @return the number of paths accepted
     */
    public int resolveConnections( final List<Connection> connections, final int iteration ) {
        final List<PathSupport> candidates = groupByPath(connections);
        for ( final PathSupport candidate : candidates ) {
            for ( final int edge : candidate.getPath().getInnerEdgeCounts().keySet() ) {
                graph.getEdge(edge).addSupport(candidate.getSupport());
            }
        }

        final List<PathSupport> acceptable = getAcceptablePaths(candidates);
        acceptable.sort(PathSupport.BY_SUPPORT_THEN_DISCOVERY);

        final Int2IntOpenHashMap copiesGranted = new Int2IntOpenHashMap();
        final IntSet claimedEntries = new IntOpenHashSet();
        final IntSet claimedExits = new IntOpenHashSet();
        int nAccepted = 0;
        for ( final PathSupport candidate : acceptable ) {
            final GraphPath path = candidate.getPath();
            if ( !graph.isContiguous(path) ) {
                logger.debug("Skipping " + path + ": no longer contiguous");
                continue;
            }
            if ( !innerEdgesPending(path) ) {
                logger.debug("Skipping " + path + ": a repeat it traverses was retained unresolved");
                continue;
            }
            if ( claimedEntries.contains(path.getFirst()) || claimedExits.contains(path.getLast()) ) {
                logger.debug("Skipping " + path + ": flank already rewired in this iteration");
                continue;
            }
            if ( isBudgetExhausted(path, copiesGranted) ) {
                logger.debug("Skipping " + path + ": repeat copies already granted to better supported paths");
                continue;
            }
            try {
                final int separatedEdge = separator.separate(path, candidate.getRepresentativeSegment());
                if ( separatedEdge == RepeatGraph.NO_HANDLE ) {
                    statistics.addInPlaceResolution();
                } else {
                    statistics.addSeparation();
                }
                for ( final Int2IntMap.Entry entry : path.getInnerEdgeCounts().int2IntEntrySet() ) {
                    copiesGranted.addTo(entry.getIntKey(), entry.getIntValue());
                }
                claimedEntries.add(path.getFirst());
                claimedExits.add(path.getLast());
                nAccepted += 1;
            } catch ( final ResolverException.MultiplicityInconsistencyException e ) {
                retainInconsistentEdges(path, iteration);
            }
        }
        return nAccepted;
    }

    @VisibleForTesting
    static List<PathSupport> groupByPath( final List<Connection> connections ) {
        final Map<GraphPath, PathSupport> byPath = new LinkedHashMap<>();
        for ( final Connection connection : connections ) {
            byPath.computeIfAbsent(connection.getPath(), path -> new PathSupport(path, byPath.size()))
                    .addConnection(connection);
        }
        return new ArrayList<>(byPath.values());
    }

    private List<PathSupport> getAcceptablePaths( final List<PathSupport> candidates ) {
        final Int2IntOpenHashMap entryTotals = new Int2IntOpenHashMap();
        final Int2IntOpenHashMap exitTotals = new Int2IntOpenHashMap();
        for ( final PathSupport candidate : candidates ) {
            entryTotals.addTo(candidate.getPath().getFirst(), candidate.getSupport());
            exitTotals.addTo(candidate.getPath().getLast(), candidate.getSupport());
        }

        final List<PathSupport> acceptable = new ArrayList<>(candidates.size());
        for ( final PathSupport candidate : candidates ) {
            final GraphPath path = candidate.getPath();
            final int threshold = getSupportThreshold(path);
            if ( candidate.getSupport() < threshold ) {
                logger.debug("Path " + path + " has support " + candidate.getSupport() + ", below " + threshold);
                continue;
            }
            if ( minFlankConfidence > 0.0 ) {
                final double confidence = flankConfidence(candidate.getSupport(),
                        entryTotals.get(path.getFirst()), exitTotals.get(path.getLast()));
                if ( confidence < minFlankConfidence ) {
                    logger.debug("Path " + path + " has flank confidence " + confidence);
                    continue;
                }
            }
            acceptable.add(candidate);
        }
        return acceptable;
    }

    /** support of a path relative to the mean support of the competing paths at its two flanks */
    @VisibleForTesting
    static double flankConfidence( final int support, final int entryTotal, final int exitTotal ) {
        Utils.validateArg(entryTotal >= support && exitTotal >= support, "flank totals must include the path");
        return support / ((entryTotal + exitTotal) / 2.0);
    }

    @VisibleForTesting
    int getSupportThreshold( final GraphPath path ) {
        if ( supportThresholdOverride != null ) {
            return supportThresholdOverride;
        }
        int threshold = 1;
        for ( final int edge : path.getInnerEdgeCounts().keySet() ) {
            final GraphEdge graphEdge = graph.getEdge(edge);
            threshold = Math.max(threshold, estimator.estimate(graph, graphEdge).getSupportThreshold());
        }
        return threshold;
    }

    private boolean innerEdgesPending( final GraphPath path ) {
        for ( final int edge : path.getInnerEdgeCounts().keySet() ) {
            if ( !graph.getEdge(edge).isRepeatPending() ) {
                return false;
            }
        }
        return true;
    }

    /**
     * A path whose edges were partly handed to earlier paths this iteration waits for the next one.
     * If no earlier path took any copies, the shortfall is real and is left for the separator to report.
     */
    private boolean isBudgetExhausted( final GraphPath path, final Int2IntMap copiesGranted ) {
        for ( final Int2IntMap.Entry entry : path.getInnerEdgeCounts().int2IntEntrySet() ) {
            final int edge = entry.getIntKey();
            if ( copiesGranted.get(edge) > 0 &&
                    PathSeparator.remainingCopies(graph.getEdge(edge)) < entry.getIntValue() ) {
                return true;
            }
        }
        return false;
    }

    private void retainInconsistentEdges( final GraphPath path, final int iteration ) {
        for ( final Int2IntMap.Entry entry : path.getInnerEdgeCounts().int2IntEntrySet() ) {
            final GraphEdge edge = graph.getEdge(entry.getIntKey());
            final int remaining = PathSeparator.remainingCopies(edge);
            if ( remaining < entry.getIntValue() ) {
                final MultiplicityInconsistency inconsistency =
                        new MultiplicityInconsistency(iteration, edge.getId(), path, remaining, entry.getIntValue());
                logger.warn("Multiplicity inconsistency, retaining edge unresolved: " + inconsistency);
                inconsistencies.add(inconsistency);
                statistics.addInconsistency();
                if ( edge.getState() != EdgeState.UNRESOLVED_RETAINED ) {
                    edge.setState(EdgeState.UNRESOLVED_RETAINED);
                    statistics.addRetained();
                }
            }
        }
    }

    /**
     * All connections confirming one path, in the order they were found.
     */
    @VisibleForTesting
    static final class PathSupport {
        static final Comparator<PathSupport> BY_SUPPORT_THEN_DISCOVERY =
                Comparator.comparingInt(PathSupport::getSupport).reversed()
                        .thenComparingInt(PathSupport::getDiscoveryIndex);

        private final GraphPath path;
        private final int discoveryIndex;
        private final List<Connection> connections = new ArrayList<>();

        PathSupport( final GraphPath path, final int discoveryIndex ) {
            this.path = path;
            this.discoveryIndex = discoveryIndex;
        }

        void addConnection( final Connection connection ) { connections.add(connection); }

        GraphPath getPath() { return path; }
        int getDiscoveryIndex() { return discoveryIndex; }
        int getSupport() { return connections.size(); }
        List<Connection> getConnections() { return connections; }

        /** the read segment of the first connection found, used as the content of a separated edge */
        SequenceSegment getRepresentativeSegment() { return connections.get(0).getReadSegment(); }

        @Override public String toString() {
            return path + " x" + getSupport();
        }
    }
}
