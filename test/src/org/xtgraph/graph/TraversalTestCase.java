/* @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.xtgraph.AbstractGraphTestCase;
import org.xtgraph.graph.Misc.Filter;

public class TraversalTestCase extends AbstractGraphTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(TraversalTestCase.class);
    }

    public TraversalTestCase(String name) {
        super(name);
    }

    private static final int A = 0, B = 1, C = 2, D = 3;

    private DirectedGraph diamond;

    protected void setUp() throws Exception {
        super.setUp();
        diamond = new DirectedGraph();
        for (int i = 0; i < 4; ++i) diamond.addVertex();
        diamond.addEdge(A, B);
        diamond.addEdge(A, C);
        diamond.addEdge(B, D);
        diamond.addEdge(C, D);
    }

    /*
     * records every event as a short string
     */
    private static class Recorder extends GraphVisitor<Edge> {
        final List<Integer> discovered = new ArrayList<Integer>();
        final List<Integer> finished = new ArrayList<Integer>();
        final List<String> events = new ArrayList<String>();

        @Override
        public void discoverVertex(int u, Graph<Edge> g) {
            discovered.add(u);
        }

        @Override
        public void finishVertex(int u, Graph<Edge> g) {
            finished.add(u);
        }

        @Override
        public void treeEdge(Edge e, Graph<Edge> g) {
            events.add("tree" + e);
        }

        @Override
        public void grayTarget(Edge e, Graph<Edge> g) {
            events.add("gray" + e);
        }

        @Override
        public void blackTarget(Edge e, Graph<Edge> g) {
            events.add("black" + e);
        }

        @Override
        public void backEdge(Edge e, Graph<Edge> g) {
            events.add("back" + e);
        }

        @Override
        public void forwardOrCrossEdge(Edge e, Graph<Edge> g) {
            events.add("cross" + e);
        }
    }

    public void testBreadthFirstDiamond() {
        Recorder vis = new Recorder();
        BreadthFirstSearch.search(diamond, A, vis);
        assertEquals(Arrays.asList(A, B, C, D), vis.discovered);
        assertEquals(1, Collections.frequency(vis.discovered, D));
        assertEquals(Arrays.asList(A, B, C, D), vis.finished);
        assertEquals(Arrays.asList("tree(0 -> 1)", "tree(0 -> 2)", "tree(1 -> 3)", "gray(2 -> 3)"),
            vis.events);
    }

    public void testBreadthFirstStop() {
        Recorder vis = new Recorder() {
            @Override
            public void discoverVertex(int u, Graph<Edge> g) {
                super.discoverVertex(u, g);
                if (u == B) stop();
            }
        };
        BreadthFirstSearch.search(diamond, A, vis);
        assertTrue(vis.isStopped());
        assertEquals(Arrays.asList(A, B), vis.discovered);
        assertTrue(vis.finished.isEmpty());

        // a stopped visitor may be reused
        vis.discovered.clear();
        BreadthFirstSearch.search(diamond, C, vis);
        assertEquals(Arrays.asList(C, D), vis.discovered);
    }

    public void testBreadthFirstIfPush() {
        Recorder vis = new Recorder();
        BreadthFirstSearch.search(diamond,
            Collections.singleton(A),
            ArrayPropertyMap.<Color>withDefault(Color.WHITE),
            vis,
            new Filter<Edge>() {
                public boolean filter(Edge e) {
                    return e.target() != C;
                }
            });
        assertEquals(Arrays.asList(A, B, D), vis.discovered);
    }

    public void testBreadthFirstMultiSource() {
        ArrayPropertyMap<Color> colors = ArrayPropertyMap.withDefault(Color.WHITE);
        colors.put(B, Color.BLACK);
        Recorder vis = new Recorder();
        BreadthFirstSearch.search(diamond, Arrays.asList(C, B), colors, vis, null);
        assertEquals(Arrays.asList(C, D), vis.discovered);
        assertEquals(Color.BLACK, colors.get(D));
        assertEquals(Color.WHITE, colors.get(A));
    }

    public void testDepthFirstDiamond() {
        Recorder vis = new Recorder();
        DepthFirstSearch.search(diamond, A, vis);
        assertEquals(Arrays.asList(A, B, D, C), vis.discovered);
        assertEquals(Arrays.asList(D, B, C, A), vis.finished);
        assertTrue(vis.events.contains("cross(2 -> 3)"));
    }

    public void testDepthFirstBackEdge() {
        diamond.addEdge(D, A);
        Recorder vis = new Recorder();
        DepthFirstSearch.search(diamond, vis);
        assertTrue(vis.events.contains("back(3 -> 0)"));
    }

    public void testDepthFirstDeepChain() {
        DirectedGraph g = new DirectedGraph();
        int n = 20000;
        g.addVertex();
        for (int i = 1; i < n; ++i) g.addEdge(i - 1, g.addVertex());
        Recorder vis = new Recorder();
        DepthFirstSearch.search(g, 0, vis);
        assertEquals(n, vis.discovered.size());
        assertEquals(Integer.valueOf(n - 1), vis.finished.get(0));
    }

    public void testTopologicalSort() {
        List<Integer> order = TopologicalSort.sort(diamond);
        assertEquals(Arrays.asList(A, C, B, D), order);
        for (Edge e : diamond.edges()) {
            assertTrue(e.toString(), order.indexOf(e.source()) < order.indexOf(e.target()));
        }
        assertTrue(TopologicalSort.isAcyclic(diamond));
    }

    public void testTopologicalSortCycle() {
        diamond.addEdge(D, B);
        try {
            TopologicalSort.sort(diamond);
            fail();
        } catch (PreconditionException e) {
            // ok
        }
        assertFalse(TopologicalSort.isAcyclic(diamond));
    }

    public void testUndirectedBreadthFirst() {
        UndirectedGraph g = new UndirectedGraph();
        for (int i = 0; i < 3; ++i) g.addVertex();
        g.addEdge(2, 1);
        g.addEdge(1, 0);
        Recorder vis = new Recorder();
        BreadthFirstSearch.search(g, 0, vis);
        assertEquals(Arrays.asList(0, 1, 2), vis.discovered);
    }
}
