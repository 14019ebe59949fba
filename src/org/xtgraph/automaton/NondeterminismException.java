/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

/**
 * Thrown when an algorithm that needs a deterministic automaton meets an
 * ambiguous transition or an epsilon transition.
 */
public class NondeterminismException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int state;
    private final char symbol;

    public NondeterminismException(String msg, int state, char symbol) {
        super(msg + ": state " + state + ", symbol '" + symbol + "'");
        this.state = state;
        this.symbol = symbol;
    }

    public int state() {
        return state;
    }

    public char symbol() {
        return symbol;
    }
}
