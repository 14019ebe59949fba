/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.LinkedList;
import java.util.List;

/**
 * Topological order by depth-first finish time.
 */
public final class TopologicalSort {

    private TopologicalSort() {
    }

    /**
     * @return every vertex of <code>g</code>, each before all vertices it
     *         reaches
     * @throws PreconditionException if <code>g</code> has a cycle
     */
    public static <E> List<Integer> sort(Graph<E> g) {
        return sort(g, g.vertices());
    }

    /**
     * Same as {@link #sort(Graph)}, restricted to the vertices reachable from
     * <code>sources</code>.
     */
    public static <E> List<Integer> sort(Graph<E> g, Iterable<Integer> sources) {
        final LinkedList<Integer> ret = new LinkedList<Integer>();
        DepthFirstSearch.search(g, sources, new GraphVisitor<E>() {
            @Override
            public void backEdge(E e, Graph<E> g) {
                throw new PreconditionException("not a DAG: back edge "
                    + g.source(e) + " -> " + g.target(e));
            }

            @Override
            public void finishVertex(int u, Graph<E> g) {
                ret.addFirst(u);
            }
        });
        return ret;
    }

    public static <E> boolean isAcyclic(Graph<E> g) {
        try {
            sort(g);
            return true;
        } catch (PreconditionException e) {
            return false;
        }
    }
}
