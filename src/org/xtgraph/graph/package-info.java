/*
 * @LICENSE@
 */

/**
 * Generic graphs over integer vertex handles, property maps that attach data
 * to vertices and edges, filtered views, and visitor-driven breadth-first and
 * depth-first traversal.
 * <p>
 * Algorithms are written against {@link org.xtgraph.graph.Graph} only; the
 * automaton types in <code>org.xtgraph.automaton</code> implement it too, so
 * the same traversals drive determinization and minimization.
 * <p>
 * Logging goes through <code>java.util.logging</code> under the logger name
 * <code>org.xtgraph</code>; traversal events are logged at
 * <code>FINER</code>.
 */
package org.xtgraph.graph;
