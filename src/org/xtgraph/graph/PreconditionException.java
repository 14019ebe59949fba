/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Thrown when an algorithm is handed an input outside of its domain, e.g. a
 * cyclic graph where a DAG is required.
 */
public class PreconditionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public PreconditionException(String msg) {
        super(msg);
    }
}
