/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

/**
 * A runtime exception thrown when an automaton cannot be constructed within
 * the configured limits.
 */
public class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
