/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Read-only incidence contract every graph kind implements; traversal and
 * construction algorithms are written once against it.
 * <p>
 * Vertices are opaque <code>int</code> handles, unique within one graph
 * instance. All iterables are finite and restartable: each call to
 * <code>iterator()</code> starts over.
 *
 * @param <E> edge type
 */
public interface Graph<E> {

    Iterable<Integer> vertices();

    Iterable<E> edges();

    /**
     * @param u a vertex of this graph
     * @return the edges leaving <code>u</code>; for an undirected graph, every
     *         edge incident to <code>u</code>, seen from <code>u</code>. The
     *         result is a snapshot taken at call time, so the graph may be
     *         changed while it is iterated.
     */
    Iterable<E> outEdges(int u);

    int source(E e);

    int target(E e);

    int numVertices();

    int numEdges();

    boolean containsVertex(int u);
}
