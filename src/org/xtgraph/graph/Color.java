/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Traversal status of a vertex: undiscovered, discovered but not finished,
 * finished.
 */
public enum Color {
    WHITE, GRAY, BLACK
}
