/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Undirected multigraph. Each edge is stored under both endpoints;
 * {@link #outEdges(int)} reports it oriented away from the queried vertex,
 * {@link #edges()} reports it once with <code>source &lt;= target</code>.
 */
public class UndirectedGraph extends AdjacencyGraph {

    public Edge addEdge(int u, int v) {
        int a = Math.min(u, v), b = Math.max(u, v);
        int n = link(a, b);
        if (a != b) {
            neighbors(b).put(a, neighbors(a).get(b));
        }
        return new Edge(u, v, n);
    }

    public void removeEdge(Edge e) {
        int a = Math.min(e.source, e.target), b = Math.max(e.source, e.target);
        unlink(a, b, e.distinguisher);
        if (a != b && !neighbors(a).containsKey(b)) neighbors(b).remove(a);
    }

    public Iterable<Edge> edges() {
        List<Edge> ret = new ArrayList<Edge>();
        for (int u : adjacencies.keySet()) {
            for (Edge e : outEdges(u)) if (e.source <= e.target) ret.add(e);
        }
        return ret;
    }

    /**
     * Same edges as {@link #outEdges(int)}, oriented towards <code>v</code>.
     */
    public Iterable<Edge> inEdges(int v) {
        List<Edge> ret = new ArrayList<Edge>();
        for (Edge e : outEdges(v)) ret.add(new Edge(e.target, e.source, e.distinguisher));
        return ret;
    }
}
