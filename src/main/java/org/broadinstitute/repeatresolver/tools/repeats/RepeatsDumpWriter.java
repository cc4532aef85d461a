package org.broadinstitute.repeatresolver.tools.repeats;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.repeatresolver.alignment.ReadAligner;
import org.broadinstitute.repeatresolver.alignment.ReadAlignment;
import org.broadinstitute.repeatresolver.exceptions.UserException;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphEdge;
import org.broadinstitute.repeatresolver.graph.GraphNode;
import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.utils.Utils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Writes the repeats that resolution could not untangle, with the names of the reads that enter, leave and
 * traverse each of them.  For every unresolved edge, in handle order:
 * <pre>
 * #Repeat edge multiplicity length
 * #Input inEdge      (one block per edge entering the repeat)
 * read names, one per line
 * #Output outEdge    (one block per edge leaving the repeat)
 * read names
 * #All reads
 * read names
 * </pre>
 */
public final class RepeatsDumpWriter {
    private static final Logger logger = LogManager.getLogger(RepeatsDumpWriter.class);

    private final RepeatGraph graph;
    private final ReadAligner aligner;

    public RepeatsDumpWriter( final RepeatGraph graph, final ReadAligner aligner ) {
        this.graph = Utils.nonNull(graph, "graph");
        this.aligner = Utils.nonNull(aligner, "aligner");
    }

    public void write( final Path outputPath ) {
        Utils.nonNull(outputPath, "outputPath");
        int nRepeats = 0;
        try ( final BufferedWriter writer = Files.newBufferedWriter(outputPath) ) {
            for ( final GraphEdge edge : graph.getEdges() ) {
                if ( isUnresolved(edge) ) {
                    writeRepeat(edge, writer);
                    nRepeats += 1;
                }
            }
        } catch ( final IOException ioe ) {
            throw new UserException.CouldNotCreateOutputFile(outputPath, "failed to write repeats dump", ioe);
        }
        logger.info("Wrote " + nRepeats + " unresolved repeats to " + outputPath);
    }

    static boolean isUnresolved( final GraphEdge edge ) {
        return edge.getState() == EdgeState.REPEAT_PENDING || edge.getState() == EdgeState.UNRESOLVED_RETAINED;
    }

    private void writeRepeat( final GraphEdge edge, final Writer writer ) throws IOException {
        final int edgeId = edge.getId();
        final List<ReadAlignment> alignments = aligner.query(graph, edgeId);
        writer.write("#Repeat " + edgeId + " " + edge.getMultiplicity() + " " + edge.getLength() + "\n");

        final GraphNode source = graph.getNode(edge.getSource());
        for ( final int inEdge : source.getInEdges() ) {
            if ( inEdge == edgeId ) {
                continue;
            }
            writer.write("#Input " + inEdge + "\n");
            writeNames(readsWithStep(alignments, inEdge, edgeId), writer);
        }
        final GraphNode target = graph.getNode(edge.getTarget());
        for ( final int outEdge : target.getOutEdges() ) {
            if ( outEdge == edgeId ) {
                continue;
            }
            writer.write("#Output " + outEdge + "\n");
            writeNames(readsWithStep(alignments, edgeId, outEdge), writer);
        }

        final Set<String> allReads = new LinkedHashSet<>();
        for ( final ReadAlignment alignment : alignments ) {
            if ( alignment.getPath().contains(edgeId) ) {
                allReads.add(alignment.getReadId().getName());
            }
        }
        writer.write("#All reads\n");
        writeNames(allReads, writer);
    }

    /** names of reads whose path steps directly from one edge into the other */
    private static Set<String> readsWithStep( final List<ReadAlignment> alignments, final int from, final int to ) {
        final Set<String> names = new LinkedHashSet<>();
        for ( final ReadAlignment alignment : alignments ) {
            final GraphPath path = alignment.getPath();
            for ( int idx = 1; idx < path.size(); ++idx ) {
                if ( path.get(idx - 1) == from && path.get(idx) == to ) {
                    names.add(alignment.getReadId().getName());
                    break;
                }
            }
        }
        return names;
    }

    private static void writeNames( final Set<String> names, final Writer writer ) throws IOException {
        for ( final String name : names ) {
            writer.write(name);
            writer.write('\n');
        }
    }
}
