package org.broadinstitute.repeatresolver.tools.repeats;

import org.broadinstitute.repeatresolver.alignment.ReadAlignment;
import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.GraphPath;
import org.broadinstitute.repeatresolver.sequence.SequenceId;
import org.broadinstitute.repeatresolver.testutils.BaseTest;
import org.broadinstitute.repeatresolver.testutils.TangleFixture;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.List;
import java.util.stream.Collectors;

public class ConnectionExtractorUnitTest extends BaseTest {

    private static TangleFixture classifiedTangle() {
        final TangleFixture fixture = new TangleFixture();
        fixture.graph.getEdge(fixture.r).setState(EdgeState.REPEAT_PENDING);
        return fixture;
    }

    private static ConnectionExtractor extractor( final TangleFixture fixture, final int nThreads ) {
        return new ConnectionExtractor(fixture.graph, fixture.aligner, fixture.reads, nThreads);
    }

    @Test
    public void testSpanningReadsGiveOneConnectionEach() {
        final TangleFixture fixture = classifiedTangle();
        final GraphPath path = GraphPath.of(fixture.u1, fixture.r, fixture.v1);
        fixture.addSpanningReads("x", 3, path);

        final List<Connection> connections = extractor(fixture, 1).getConnections();
        Assert.assertEquals(connections.size(), 3);
        for ( int idx = 0; idx != 3; ++idx ) {
            final Connection connection = connections.get(idx);
            Assert.assertEquals(connection.getPath(), path);
            Assert.assertEquals(connection.getReadSegment().getSequenceId(), SequenceId.read("x" + idx));
            Assert.assertEquals(connection.getReadSegment().getStart(), TangleFixture.SPAN_START);
            Assert.assertEquals(connection.getReadSegment().getEnd(), TangleFixture.SPAN_END);
        }
    }

    @DataProvider(name = "invalidAlignments")
    public Object[][] invalidAlignments() {
        final TangleFixture layout = new TangleFixture();
        return new Object[][] {
                // enters the repeat but never leaves it
                { GraphPath.of(layout.u1, layout.r), 100, 900 },
                // leaves without having entered from a flank
                { GraphPath.of(layout.r, layout.v1), 100, 900 },
                // steps from u1 straight into v1, which are not adjacent
                { GraphPath.of(layout.u1, layout.v1, layout.r), 100, 900 },
                // empty span
                { GraphPath.of(layout.u1, layout.r, layout.v1), 400, 400 },
                // span runs off the end of the read
                { GraphPath.of(layout.u1, layout.r, layout.v1), 100, TangleFixture.READ_LENGTH + 1 },
                // negative start
                { GraphPath.of(layout.u1, layout.r, layout.v1), -1, 900 },
                // enters and leaves by the same edge
                { GraphPath.of(layout.u1, layout.r, layout.u1), 100, 900 },
        };
    }

    @Test(dataProvider = "invalidAlignments")
    public void testInvalidAlignmentsAreSkipped( final GraphPath path, final int spanStart, final int spanEnd ) {
        final TangleFixture fixture = classifiedTangle();
        final SequenceId read = fixture.addRead("bad");
        fixture.aligner.addForEdge(fixture.r, new ReadAlignment(read, path, spanStart, spanEnd));
        Assert.assertTrue(extractor(fixture, 1).connectionsThroughEdge(fixture.r).isEmpty());
    }

    @Test
    public void testAlignmentNotThroughQueriedEdgeIsSkipped() {
        final TangleFixture fixture = classifiedTangle();
        final SequenceId read = fixture.addRead("elsewhere");
        final int r2 = fixture.addContig(fixture.n1, fixture.n2, "r2", 400);
        fixture.graph.getEdge(r2).setState(EdgeState.REPEAT_PENDING);
        fixture.aligner.addForEdge(fixture.r, new ReadAlignment(read, GraphPath.of(fixture.u1, r2, fixture.v1), 100, 900));
        Assert.assertTrue(extractor(fixture, 1).connectionsThroughEdge(fixture.r).isEmpty());
    }

    @Test
    public void testUnknownReadIsSkipped() {
        final TangleFixture fixture = classifiedTangle();
        fixture.aligner.add(new ReadAlignment(SequenceId.read("ghost"),
                GraphPath.of(fixture.u1, fixture.r, fixture.v1), 100, 900));
        Assert.assertTrue(extractor(fixture, 1).getConnections().isEmpty());
    }

    @Test
    public void testRepeatFlankIsNotAnAnchor() {
        final TangleFixture fixture = classifiedTangle();
        fixture.graph.getEdge(fixture.u1).setState(EdgeState.REPEAT_PENDING);
        fixture.addSpanningReads("x", 2, GraphPath.of(fixture.u1, fixture.r, fixture.v1));
        Assert.assertTrue(extractor(fixture, 1).getConnections().isEmpty());
    }

    @Test
    public void testSeparatedFlankIsAnAnchor() {
        final TangleFixture fixture = classifiedTangle();
        fixture.graph.getEdge(fixture.u1).setState(EdgeState.SEPARATED);
        fixture.addSpanningReads("x", 2, GraphPath.of(fixture.u1, fixture.r, fixture.v1));
        Assert.assertEquals(extractor(fixture, 1).getConnections().size(), 2);
    }

    @Test
    public void testRetainedInnerEdgeIsNotTraversable() {
        final TangleFixture fixture = classifiedTangle();
        fixture.addSpanningReads("x", 2, GraphPath.of(fixture.u1, fixture.r, fixture.v1));
        final ConnectionExtractor extractor = extractor(fixture, 1);
        Assert.assertEquals(extractor.connectionsThroughEdge(fixture.r).size(), 2);
        fixture.graph.getEdge(fixture.r).setState(EdgeState.UNRESOLVED_RETAINED);
        Assert.assertTrue(extractor.connectionsThroughEdge(fixture.r).isEmpty());
        Assert.assertTrue(extractor.getConnections().isEmpty());
    }

    @Test
    public void testAmbiguousReadIsSkipped() {
        final TangleFixture fixture = classifiedTangle();
        final SequenceId read = fixture.addRead("torn");
        fixture.aligner.add(new ReadAlignment(read, GraphPath.of(fixture.u1, fixture.r, fixture.v1), 100, 900));
        fixture.aligner.add(new ReadAlignment(read, GraphPath.of(fixture.u1, fixture.r, fixture.v2), 100, 900));
        fixture.addSpanningReads("x", 1, GraphPath.of(fixture.u2, fixture.r, fixture.v2));

        final List<Connection> connections = extractor(fixture, 1).getConnections();
        Assert.assertEquals(connections.size(), 1);
        Assert.assertEquals(connections.get(0).getReadSegment().getSequenceId(), SequenceId.read("x0"));
    }

    @Test
    public void testRepeatedAlignmentOfSamePathIsNotAmbiguous() {
        final TangleFixture fixture = classifiedTangle();
        final SequenceId read = fixture.addRead("twice");
        final GraphPath path = GraphPath.of(fixture.u1, fixture.r, fixture.v1);
        fixture.aligner.addForEdge(fixture.r, new ReadAlignment(read, path, 100, 900));
        fixture.aligner.addForEdge(fixture.r, new ReadAlignment(read, path, 120, 880));
        final List<Connection> connections = extractor(fixture, 1).getConnections();
        Assert.assertEquals(connections.size(), 1);
        Assert.assertEquals(connections.get(0).getReadSegment().getStart(), 100);
    }

    // u1 -> r -> s -> v1, where r and s are both repeats
    private static TangleFixture makeChain() {
        final TangleFixture fixture = new TangleFixture();
        final int middle = fixture.graph.addNode();
        final int s = fixture.addContig(middle, fixture.n2, "s", 200);
        fixture.graph.moveEdgeTarget(fixture.r, middle);
        fixture.graph.getEdge(fixture.r).setState(EdgeState.REPEAT_PENDING);
        fixture.graph.getEdge(s).setState(EdgeState.REPEAT_PENDING);
        return fixture;
    }

    @Test
    public void testReadCountedOncePerPath() {
        final TangleFixture fixture = makeChain();
        final int s = fixture.graph.getNode(fixture.n2).getInEdges().getInt(0);
        final GraphPath path = GraphPath.of(fixture.u1, fixture.r, s, fixture.v1);
        fixture.addSpanningReads("x", 2, path);

        final ConnectionExtractor extractor = extractor(fixture, 1);
        Assert.assertEquals(extractor.connectionsThroughEdge(fixture.r).size(), 2);
        Assert.assertEquals(extractor.connectionsThroughEdge(s).size(), 2);
        final List<Connection> connections = extractor.getConnections();
        Assert.assertEquals(connections.size(), 2);
        Assert.assertEquals(connections.get(0).getPath(), path);
    }

    @Test(dataProvider = "threadCounts")
    public void testDiscoveryOrderDoesNotDependOnThreads( final int nThreads ) {
        final TangleFixture fixture = makeChain();
        final int s = fixture.graph.getNode(fixture.n2).getInEdges().getInt(0);
        final int loop = fixture.addContig(fixture.c, fixture.c, "loop", 100);
        final int tail = fixture.addContig(fixture.c, fixture.graph.addNode(), "tail", 300);
        fixture.graph.getEdge(loop).setState(EdgeState.REPEAT_PENDING);
        fixture.addSpanningReads("x", 3, GraphPath.of(fixture.u1, fixture.r, s, fixture.v1));
        fixture.addSpanningReads("y", 2, GraphPath.of(fixture.u2, fixture.r, s, fixture.v2));
        fixture.addSpanningReads("z", 2, GraphPath.of(fixture.v1, loop, loop, tail));

        final List<String> expected = describe(extractor(fixture, 1).getConnections());
        Assert.assertEquals(expected.size(), 7);
        Assert.assertEquals(describe(extractor(fixture, nThreads).getConnections()), expected);
    }

    @DataProvider(name = "threadCounts")
    public Object[][] threadCounts() {
        return new Object[][] { {1}, {2}, {3}, {8} };
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testThreadCountMustBePositive() {
        extractor(classifiedTangle(), 0);
    }

    private static List<String> describe( final List<Connection> connections ) {
        return connections.stream().map(Connection::toString).collect(Collectors.toList());
    }
}
