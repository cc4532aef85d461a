package org.broadinstitute.repeatresolver.tools.repeats;

import org.broadinstitute.repeatresolver.graph.EdgeState;
import org.broadinstitute.repeatresolver.graph.RepeatGraph;
import org.broadinstitute.repeatresolver.testutils.BaseTest;
import org.broadinstitute.repeatresolver.testutils.TangleFixture;
import org.testng.Assert;
import org.testng.annotations.Test;

public class UnsupportedEdgePrunerUnitTest extends BaseTest {

    @Test
    public void testIsSafeToRemove() {
        final TangleFixture fixture = new TangleFixture();
        final RepeatGraph graph = fixture.graph;
        Assert.assertFalse(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(fixture.r)));
        Assert.assertFalse(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(fixture.u1)));

        final int parallel = fixture.addContig(fixture.n1, fixture.n2, "r2", 100);
        Assert.assertTrue(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(fixture.r)));
        Assert.assertTrue(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(parallel)));

        final int detour = fixture.addContig(fixture.n1, fixture.c, "detour", 100);
        Assert.assertTrue(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(detour)));
        Assert.assertFalse(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(fixture.u1)));
        // another way out of the source is not enough if the target has no other way in
        final int dangling = fixture.addContig(fixture.n1, graph.addNode(), "dangling", 100);
        Assert.assertFalse(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(dangling)));
    }

    @Test
    public void testLoopNeedsOtherEdgesAtItsJunction() {
        final TangleFixture fixture = new TangleFixture();
        final RepeatGraph graph = fixture.graph;
        final int loop = fixture.addContig(fixture.n1, fixture.n1, "loop", 40);
        // n1 is entered by u1 and u2 and left by r besides the loop
        Assert.assertTrue(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(loop)));
        final int lonelyLoop = fixture.addContig(fixture.c, fixture.c, "lonely", 40);
        Assert.assertFalse(UnsupportedEdgePruner.isSafeToRemove(graph, graph.getEdge(lonelyLoop)));
    }

    @Test
    public void testRemoveUnsupportedEdges() {
        final TangleFixture fixture = new TangleFixture();
        final RepeatGraph graph = fixture.graph;
        final int supported = fixture.addContig(fixture.n1, fixture.n2, "supported", 100);
        final int confident = fixture.addContig(fixture.n1, fixture.n2, "confident", 100);
        for ( final int edge : new int[] {fixture.r, supported, confident} ) {
            graph.getEdge(edge).setState(EdgeState.REPEAT_PENDING);
        }
        graph.getEdge(supported).addSupport(1);
        fixture.estimator.set(fixture.r, 1, 1, 0.2)
                         .set(supported, 1, 1, 0.2)
                         .set(confident, 1, 1, 0.8);
        // unsupported but not pending: never considered
        fixture.estimator.set(fixture.u1, 1, 1, 0.0);

        final ResolutionStatistics stats = new ResolutionStatistics();
        final UnsupportedEdgePruner pruner = new UnsupportedEdgePruner(graph, fixture.estimator, 0.5, stats);
        Assert.assertEquals(pruner.removeUnsupportedEdges(), 1);
        Assert.assertFalse(graph.containsEdge(fixture.r));
        Assert.assertTrue(graph.getLedger().wasPruned(fixture.r));
        Assert.assertTrue(graph.containsEdge(supported));
        Assert.assertTrue(graph.containsEdge(confident));
        Assert.assertTrue(graph.containsEdge(fixture.u1));
        Assert.assertEquals(stats.getPrunedEdges(), 1);

        // nothing left to do the second time round
        Assert.assertEquals(pruner.removeUnsupportedEdges(), 0);
    }

    @Test
    public void testUnsafeEdgeIsRetained() {
        final TangleFixture fixture = new TangleFixture();
        final RepeatGraph graph = fixture.graph;
        graph.getEdge(fixture.r).setState(EdgeState.REPEAT_PENDING);
        fixture.estimator.set(fixture.r, 1, 1, 0.0);
        final ResolutionStatistics stats = new ResolutionStatistics();
        Assert.assertEquals(new UnsupportedEdgePruner(graph, fixture.estimator, 0.5, stats).removeUnsupportedEdges(), 0);
        Assert.assertEquals(graph.getEdge(fixture.r).getState(), EdgeState.UNRESOLVED_RETAINED);
        Assert.assertEquals(stats.getRetainedEdges(), 1);
        Assert.assertEquals(graph.getEdgeCount(), 5);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testConfidenceOutOfRange() {
        final TangleFixture fixture = new TangleFixture();
        new UnsupportedEdgePruner(fixture.graph, fixture.estimator, 1.5, new ResolutionStatistics());
    }
}
