/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Builder side of the graph contract, called by user code or by import and
 * construction algorithms to populate a fresh graph.
 *
 * @param <E> edge type
 */
public interface MutableGraph<E> extends Graph<E> {

    /**
     * @return the handle of the new vertex
     */
    int addVertex();

    /**
     * @throws IllegalArgumentException if an endpoint is not a vertex of this
     *             graph
     */
    E addEdge(int u, int v);

    void removeEdge(E e);

    /**
     * Removes <code>u</code> and every edge incident to it.
     */
    void removeVertex(int u);
}
