/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.Collections;
import java.util.LinkedList;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtgraph.graph.Misc.Filter;

/**
 * Breadth-first traversal with visitor callbacks.
 * <p>
 * The graph may grow while it is traversed, as long as edges are only added
 * to a vertex before its out-edges are enumerated; construction algorithms
 * rely on this by building the out-edges of a vertex in
 * {@link GraphVisitor#examineVertex(int, Graph)}. The color map must then
 * default unknown vertices to {@link Color#WHITE}.
 */
public final class BreadthFirstSearch {

    private static final Logger logger = Logger.getLogger("org.xtgraph");
    private static final Level level = Level.FINER;

    private BreadthFirstSearch() {
    }

    /**
     * Initializes every vertex of <code>g</code> to WHITE, then searches from
     * <code>s</code>.
     */
    public static <E> void search(Graph<E> g, int s, GraphVisitor<E> vis) {
        ReadWritePropertyMap<Integer, Color> colors = ArrayPropertyMap.withDefault(Color.WHITE);
        vis.reset();
        for (int u : g.vertices()) {
            colors.put(u, Color.WHITE);
            vis.initializeVertex(u, g);
            if (vis.isStopped()) return;
        }
        visit(g, Collections.singleton(s), colors, vis, null);
    }

    /**
     * Searches from every source, without initializing colors; vertices
     * already non-WHITE in <code>colors</code> are skipped.
     *
     * @param ifPush optional; an edge whose target would be discovered is
     *            followed only if the filter accepts it
     */
    public static <E> void search(Graph<E> g,
                                  Iterable<Integer> sources,
                                  ReadWritePropertyMap<Integer, Color> colors,
                                  GraphVisitor<E> vis,
                                  Filter<? super E> ifPush) {
        vis.reset();
        visit(g, sources, colors, vis, ifPush);
    }

    private static <E> void visit(Graph<E> g,
                                  Iterable<Integer> sources,
                                  ReadWritePropertyMap<Integer, Color> colors,
                                  GraphVisitor<E> vis,
                                  Filter<? super E> ifPush) {
        LinkedList<Integer> queue = new LinkedList<Integer>();
        for (int s : sources) {
            if (colors.get(s) != Color.WHITE) continue;
            colors.put(s, Color.GRAY);
            vis.discoverVertex(s, g);
            if (vis.isStopped()) { stopped(s); return; }
            queue.addLast(s);
        }
        while (!queue.isEmpty()) {
            int u = queue.removeFirst();
            vis.examineVertex(u, g);
            if (vis.isStopped()) { stopped(u); return; }
            for (E e : g.outEdges(u)) {
                int v = g.target(e);
                vis.examineEdge(e, g);
                if (vis.isStopped()) { stopped(u); return; }
                Color c = colors.get(v);
                if (c == Color.WHITE) {
                    if (ifPush != null && !ifPush.filter(e)) continue;
                    vis.treeEdge(e, g);
                    if (vis.isStopped()) { stopped(u); return; }
                    colors.put(v, Color.GRAY);
                    vis.discoverVertex(v, g);
                    if (vis.isStopped()) { stopped(v); return; }
                    queue.addLast(v);
                } else {
                    vis.nonTreeEdge(e, g);
                    if (vis.isStopped()) { stopped(u); return; }
                    if (c == Color.GRAY) vis.grayTarget(e, g);
                    else vis.blackTarget(e, g);
                    if (vis.isStopped()) { stopped(u); return; }
                }
            }
            colors.put(u, Color.BLACK);
            vis.finishVertex(u, g);
            if (vis.isStopped()) { stopped(u); return; }
        }
    }

    private static void stopped(int u) {
        if (logger.isLoggable(level)) logger.log(level, "breadth-first search stopped at " + u);
    }
}
