/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import org.xtgraph.graph.Misc.Filter;
import org.xtgraph.graph.Misc.FilterIterable;

/**
 * Read-only filtered view over another graph. A vertex is visible if the
 * vertex filter accepts it; an edge is visible if the edge filter accepts
 * it and both its endpoints are visible. Nothing is copied.
 *
 * @param <E> edge type
 */
public class GraphView<E> implements Graph<E> {

    private final Graph<E> g;
    private final Filter<? super Integer> vertexFilter;
    private final Filter<E> edgeFilter;

    public GraphView(Graph<E> g, Filter<? super Integer> vertexFilter, Filter<? super E> edgeFilter) {
        this.g = g;
        this.vertexFilter = vertexFilter;
        this.edgeFilter = Misc.<E>and(edgeFilter, new Filter<E>() {
            public boolean filter(E e) {
                return visible(source(e)) && visible(target(e));
            }
        });
    }

    /**
     * Vertex-induced view: all edges between visible vertices are visible.
     */
    public GraphView(Graph<E> g, Filter<? super Integer> vertexFilter) {
        this(g, vertexFilter, Misc.<E>passAll());
    }

    /**
     * Builds a view from relevance maps; a <code>null</code> value is
     * irrelevant, a key missing from a required map fails.
     */
    public static <E> GraphView<E> of(Graph<E> g,
                                      final PropertyMap<Integer, Boolean> vertexRelevant,
                                      final PropertyMap<? super E, Boolean> edgeRelevant) {
        return new GraphView<E>(g,
            GraphView.<Integer>relevance(vertexRelevant),
            GraphView.<E>relevance(edgeRelevant));
    }

    private static <T> Filter<T> relevance(final PropertyMap<? super T, Boolean> pm) {
        return new Filter<T>() {
            public boolean filter(T t) {
                Boolean b = pm.get(t);
                return b != null && b;
            }
        };
    }

    /**
     * @return a view over the same graph showing what both views show
     */
    public GraphView<E> and(GraphView<E> other) {
        checkSameGraph(other);
        return new GraphView<E>(g,
            Misc.<Integer>and(vertexFilter, other.vertexFilter),
            Misc.<E>and(edgeFilter, other.edgeFilter));
    }

    /**
     * @return a view over the same graph showing what either view shows
     */
    public GraphView<E> or(GraphView<E> other) {
        checkSameGraph(other);
        return new GraphView<E>(g,
            Misc.<Integer>or(vertexFilter, other.vertexFilter),
            Misc.<E>or(edgeFilter, other.edgeFilter));
    }

    private void checkSameGraph(GraphView<E> other) {
        if (other.g != g) throw new PreconditionException("views over different graphs");
    }

    public Graph<E> underlying() {
        return g;
    }

    private boolean visible(int u) {
        return g.containsVertex(u) && vertexFilter.filter(u);
    }

    public boolean containsVertex(int u) {
        return visible(u);
    }

    public Iterable<Integer> vertices() {
        return new FilterIterable<Integer>(g.vertices(), vertexFilter);
    }

    public Iterable<E> edges() {
        return new FilterIterable<E>(g.edges(), edgeFilter);
    }

    public Iterable<E> outEdges(int u) {
        return new FilterIterable<E>(g.outEdges(u), edgeFilter);
    }

    public int source(E e) {
        return g.source(e);
    }

    public int target(E e) {
        return g.target(e);
    }

    public int numVertices() {
        return Misc.count(vertices());
    }

    public int numEdges() {
        return Misc.count(edges());
    }
}
