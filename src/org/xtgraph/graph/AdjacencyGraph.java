/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Adjacency-map storage shared by {@link DirectedGraph} and
 * {@link UndirectedGraph}: vertex to neighbor to the set of distinguishers of
 * the parallel edges between them.
 * <p>
 * Vertex handles are never reused after removal, so property maps indexed
 * by handle stay valid.
 */
public abstract class AdjacencyGraph implements MutableGraph<Edge> {

    protected final Map<Integer, Map<Integer, SortedSet<Integer>>> adjacencies =
        new LinkedHashMap<Integer, Map<Integer, SortedSet<Integer>>>();

    private int nextVertex = 0;

    public final int addVertex() {
        int u = nextVertex++;
        adjacencies.put(u, new LinkedHashMap<Integer, SortedSet<Integer>>());
        return u;
    }

    public final boolean containsVertex(int u) {
        return adjacencies.containsKey(u);
    }

    public final int numVertices() {
        return adjacencies.size();
    }

    public final int numEdges() {
        return Misc.count(edges());
    }

    public final Iterable<Integer> vertices() {
        return new ArrayList<Integer>(adjacencies.keySet());
    }

    public final int source(Edge e) {
        return e.source;
    }

    public final int target(Edge e) {
        return e.target;
    }

    public Iterable<Edge> outEdges(int u) {
        List<Edge> ret = new ArrayList<Edge>();
        for (Map.Entry<Integer, SortedSet<Integer>> entry : neighbors(u).entrySet()) {
            for (int n : entry.getValue()) ret.add(new Edge(u, entry.getKey(), n));
        }
        return ret;
    }

    public int outDegree(int u) {
        int n = 0;
        for (SortedSet<Integer> s : neighbors(u).values()) n += s.size();
        return n;
    }

    /**
     * @return one edge from <code>u</code> to <code>v</code>, or
     *         <code>null</code> if there is none
     */
    public final Edge edge(int u, int v) {
        SortedSet<Integer> s = neighbors(u).get(v);
        return s == null || s.isEmpty() ? null : new Edge(u, v, s.first());
    }

    public final boolean containsEdge(Edge e) {
        if (!containsVertex(e.source)) return false;
        SortedSet<Integer> s = adjacencies.get(e.source).get(e.target);
        return s != null && s.contains(e.distinguisher);
    }

    public void removeVertex(int u) {
        neighbors(u);
        for (Edge e : Misc.listFrom(edges())) {
            if (e.source == u || e.target == u) removeEdge(e);
        }
        adjacencies.remove(u);
    }

    protected final Map<Integer, SortedSet<Integer>> neighbors(int u) {
        Map<Integer, SortedSet<Integer>> ret = adjacencies.get(u);
        if (ret == null) throw new IllegalArgumentException("no such vertex: " + u);
        return ret;
    }

    /**
     * Adds a fresh distinguisher to the (u, v) slot.
     */
    protected final int link(int u, int v) {
        neighbors(v);
        Map<Integer, SortedSet<Integer>> nbrs = neighbors(u);
        SortedSet<Integer> s = nbrs.get(v);
        if (s == null) nbrs.put(v, s = new TreeSet<Integer>());
        int n = s.isEmpty() ? 0 : s.last() + 1;
        s.add(n);
        return n;
    }

    protected final void unlink(int u, int v, int n) {
        Map<Integer, SortedSet<Integer>> nbrs = neighbors(u);
        SortedSet<Integer> s = nbrs.get(v);
        if (s == null || !s.remove(n))
            throw new IllegalArgumentException("no such edge: (" + u + " -> " + v + ")");
        if (s.isEmpty()) nbrs.remove(v);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(getClass().getSimpleName()).append(" {").append(Misc.LS);
        for (int u : adjacencies.keySet()) sb.append("  ").append(u).append(Misc.LS);
        for (Iterator<Edge> it = edges().iterator(); it.hasNext();) {
            sb.append("  ").append(it.next()).append(Misc.LS);
        }
        return sb.append("}").toString();
    }
}
