/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Depth-first traversal with visitor callbacks; same visitor contract as
 * {@link BreadthFirstSearch}. Non-recursive: the stack holds one out-edge
 * iterator per gray vertex, so deep graphs don't blow the call stack.
 */
public final class DepthFirstSearch {

    private static final Logger logger = Logger.getLogger("org.xtgraph");
    private static final Level level = Level.FINER;

    private DepthFirstSearch() {
    }

    /**
     * Visits every vertex of <code>g</code>, starting a new tree from each
     * vertex still WHITE.
     */
    public static <E> void search(Graph<E> g, GraphVisitor<E> vis) {
        search(g, g.vertices(), vis);
    }

    public static <E> void search(Graph<E> g, int s, GraphVisitor<E> vis) {
        search(g, Collections.singleton(s), vis);
    }

    public static <E> void search(Graph<E> g, Iterable<Integer> sources, GraphVisitor<E> vis) {
        ReadWritePropertyMap<Integer, Color> colors = ArrayPropertyMap.withDefault(Color.WHITE);
        vis.reset();
        for (int u : g.vertices()) {
            colors.put(u, Color.WHITE);
            vis.initializeVertex(u, g);
            if (vis.isStopped()) return;
        }
        search(g, sources, colors, vis);
    }

    /**
     * Searches from every source still WHITE in <code>colors</code>, without
     * initializing colors.
     */
    public static <E> void search(Graph<E> g,
                                  Iterable<Integer> sources,
                                  ReadWritePropertyMap<Integer, Color> colors,
                                  GraphVisitor<E> vis) {
        for (int s : sources) {
            if (colors.get(s) != Color.WHITE) continue;
            vis.startVertex(s, g);
            if (vis.isStopped() || !visitFrom(g, s, colors, vis)) {
                if (logger.isLoggable(level)) logger.log(level, "depth-first search stopped");
                return;
            }
        }
    }

    /*
     * returns false if the visitor stopped the search
     */
    private static <E> boolean visitFrom(Graph<E> g,
                                         int init,
                                         ReadWritePropertyMap<Integer, Color> colors,
                                         GraphVisitor<E> vis) {
        LinkedList<Integer> gray = new LinkedList<Integer>();
        LinkedList<Iterator<E>> eiDeq = new LinkedList<Iterator<E>>();
        Iterator<E> ei;

        colors.put(init, Color.GRAY);
        vis.discoverVertex(init, g);
        if (vis.isStopped()) return false;
        gray.addFirst(init);
        eiDeq.addFirst(g.outEdges(init).iterator());
        while (!eiDeq.isEmpty()) {
            if ((ei = eiDeq.getFirst()).hasNext()) {
                E e = ei.next();
                int v = g.target(e);
                vis.examineEdge(e, g);
                if (vis.isStopped()) return false;
                Color c = colors.get(v);
                if (c == Color.WHITE) {
                    vis.treeEdge(e, g);
                    if (vis.isStopped()) return false;
                    colors.put(v, Color.GRAY);
                    vis.discoverVertex(v, g);
                    if (vis.isStopped()) return false;
                    gray.addFirst(v);
                    eiDeq.addFirst(g.outEdges(v).iterator());
                } else {
                    if (c == Color.GRAY) vis.backEdge(e, g);
                    else vis.forwardOrCrossEdge(e, g);
                    if (vis.isStopped()) return false;
                }
            } else {
                eiDeq.removeFirst();
                int u = gray.removeFirst();
                colors.put(u, Color.BLACK);
                vis.finishVertex(u, g);
                if (vis.isStopped()) return false;
            }
        }
        assert gray.isEmpty() : gray;
        return true;
    }
}
