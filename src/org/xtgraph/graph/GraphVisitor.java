/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Event sink shared by {@link BreadthFirstSearch} and
 * {@link DepthFirstSearch}. Every hook defaults to doing nothing; override the
 * ones you care about. Any hook may call {@link #stop()}, after which the
 * search returns without firing further events.
 * <p>
 * Breadth-first events: initializeVertex, discoverVertex, examineVertex,
 * examineEdge, treeEdge, nonTreeEdge, grayTarget, blackTarget,
 * finishVertex. Depth-first events: initializeVertex, startVertex,
 * discoverVertex, examineEdge, treeEdge, backEdge, forwardOrCrossEdge,
 * finishVertex.
 *
 * @param <E> edge type
 */
public abstract class GraphVisitor<E> {

    private boolean stopped;

    public final void stop() {
        stopped = true;
    }

    public final boolean isStopped() {
        return stopped;
    }

    final void reset() {
        stopped = false;
    }

    public void initializeVertex(int u, Graph<E> g) {}

    /** Depth-first only: <code>u</code> roots a new search tree. */
    public void startVertex(int u, Graph<E> g) {}

    public void discoverVertex(int u, Graph<E> g) {}

    /** Breadth-first only: <code>u</code> was popped from the queue. */
    public void examineVertex(int u, Graph<E> g) {}

    public void examineEdge(E e, Graph<E> g) {}

    public void treeEdge(E e, Graph<E> g) {}

    public void nonTreeEdge(E e, Graph<E> g) {}

    public void grayTarget(E e, Graph<E> g) {}

    public void blackTarget(E e, Graph<E> g) {}

    public void backEdge(E e, Graph<E> g) {}

    public void forwardOrCrossEdge(E e, Graph<E> g) {}

    public void finishVertex(int u, Graph<E> g) {}
}
