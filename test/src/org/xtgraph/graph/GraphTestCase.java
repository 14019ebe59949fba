/* @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import junit.framework.TestCase;

import org.xtgraph.graph.Misc.Filter;

public class GraphTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(GraphTestCase.class);
    }

    public GraphTestCase(String name) {
        super(name);
    }

    private static List<Integer> targets(Graph<Edge> g, int u) {
        List<Integer> ret = new ArrayList<Integer>();
        for (Edge e : g.outEdges(u)) ret.add(g.target(e));
        return ret;
    }

    public void testDirected() {
        DirectedGraph g = new DirectedGraph();
        int u = g.addVertex(), v = g.addVertex(), w = g.addVertex();
        assertEquals(Arrays.asList(0, 1, 2), Arrays.asList(u, v, w));

        Edge e0 = g.addEdge(u, v);
        Edge e1 = g.addEdge(u, v);
        g.addEdge(v, w);
        assertFalse(e0.equals(e1));
        assertEquals(0, e0.distinguisher());
        assertEquals(1, e1.distinguisher());
        assertEquals(3, g.numVertices());
        assertEquals(3, g.numEdges());
        assertEquals(2, g.outDegree(u));
        assertEquals(Arrays.asList(1, 1), targets(g, u));
        assertEquals(e0, g.edge(u, v));
        assertNull(g.edge(w, u));
        assertEquals(1, Misc.count(g.inEdges(w)));

        g.removeEdge(e0);
        assertEquals(e1, g.edge(u, v));
        assertEquals(2, g.numEdges());
        assertFalse(g.containsEdge(e0));
    }

    public void testOutEdgesSnapshot() {
        DirectedGraph g = new DirectedGraph();
        int u = g.addVertex(), v = g.addVertex();
        g.addEdge(u, v);
        Iterable<Edge> out = g.outEdges(u);
        for (Edge e : out) g.addEdge(u, g.target(e));
        assertEquals(1, Misc.count(out));
        assertEquals(2, g.outDegree(u));
    }

    public void testRemoveVertex() {
        DirectedGraph g = new DirectedGraph();
        int u = g.addVertex(), v = g.addVertex(), w = g.addVertex();
        g.addEdge(u, v);
        g.addEdge(v, w);
        g.addEdge(w, u);
        g.removeVertex(v);
        assertFalse(g.containsVertex(v));
        assertEquals(2, g.numVertices());
        assertEquals(1, g.numEdges());
        assertEquals(Arrays.asList(u), targets(g, w));
        // handles are not reused
        assertEquals(3, g.addVertex());
    }

    public void testUnknownVertex() {
        DirectedGraph g = new DirectedGraph();
        g.addVertex();
        try {
            g.addEdge(0, 5);
            fail();
        } catch (IllegalArgumentException e) {
            // ok
        }
        try {
            g.outEdges(5);
            fail();
        } catch (IllegalArgumentException e) {
            // ok
        }
    }

    public void testUndirected() {
        UndirectedGraph g = new UndirectedGraph();
        int u = g.addVertex(), v = g.addVertex(), w = g.addVertex();
        g.addEdge(v, u);
        g.addEdge(v, w);
        g.addEdge(w, w);

        assertEquals(3, g.numEdges());
        for (Edge e : g.edges()) assertTrue(e.toString(), e.source() <= e.target());
        assertEquals(Arrays.asList(u, w), targets(g, v));
        assertEquals(Arrays.asList(v), targets(g, u));
        for (Edge e : g.outEdges(v)) assertEquals(v, e.source());
        for (Edge e : g.inEdges(v)) assertEquals(v, e.target());
        assertEquals(2, g.outDegree(w)); // the self loop counts once

        g.removeEdge(g.edge(u, v));
        assertEquals(2, g.numEdges());
        assertNull(g.edge(v, u));
        assertEquals(0, g.outDegree(u));
    }

    public void testView() {
        DirectedGraph g = new DirectedGraph();
        for (int i = 0; i < 4; ++i) g.addVertex();
        g.addEdge(0, 1);
        g.addEdge(0, 2);
        g.addEdge(2, 3);
        g.addEdge(1, 3);

        GraphView<Edge> no1 = new GraphView<Edge>(g, new Filter<Integer>() {
            public boolean filter(Integer u) {
                return u != 1;
            }
        });
        assertEquals(3, no1.numVertices());
        assertEquals(2, no1.numEdges());
        assertEquals(Arrays.asList(2), targets(no1, 0));
        assertFalse(no1.containsVertex(1));
        // storage untouched
        assertEquals(4, g.numEdges());

        ArrayPropertyMap<Boolean> relevant = ArrayPropertyMap.withDefault(true);
        relevant.put(2, false);
        GraphView<Edge> no2 = GraphView.of(g, relevant, PropertyMaps.<Edge, Boolean>constant(true));
        assertEquals(Arrays.asList(1), targets(no2, 0));

        assertEquals(2, no1.and(no2).numVertices());
        assertEquals(0, no1.and(no2).numEdges());
        assertEquals(4, no1.or(no2).numVertices());
        assertEquals(4, no1.or(no2).numEdges());
    }
}
