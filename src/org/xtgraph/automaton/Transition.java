/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

/**
 * Edge of an {@link Automaton} or an {@link Nfa}, labeled by one symbol (or
 * {@link Nfa#EPSILON}).
 */
public final class Transition {

    final int source;
    final char symbol;
    final int target;

    Transition(int source, char symbol, int target) {
        this.source = source;
        this.symbol = symbol;
        this.target = target;
    }

    public int source() {
        return source;
    }

    public char symbol() {
        return symbol;
    }

    public int target() {
        return target;
    }

    @Override
    public int hashCode() {
        return (source * 31 + symbol) * 31 + target;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Transition))
            return false;
        final Transition other = (Transition) obj;
        return source == other.source && symbol == other.symbol && target == other.target;
    }

    @Override
    public String toString() {
        return "(" + source + " --" + symbol + "--> " + target + ")";
    }
}
