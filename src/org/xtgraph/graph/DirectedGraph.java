/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Directed multigraph.
 */
public class DirectedGraph extends AdjacencyGraph {

    public Edge addEdge(int u, int v) {
        return new Edge(u, v, link(u, v));
    }

    public void removeEdge(Edge e) {
        unlink(e.source, e.target, e.distinguisher);
    }

    public Iterable<Edge> edges() {
        List<Edge> ret = new ArrayList<Edge>();
        for (int u : adjacencies.keySet()) {
            for (Edge e : outEdges(u)) ret.add(e);
        }
        return ret;
    }

    public Iterable<Edge> inEdges(int v) {
        neighbors(v);
        List<Edge> ret = new ArrayList<Edge>();
        for (Edge e : edges()) if (e.target == v) ret.add(e);
        return ret;
    }
}
