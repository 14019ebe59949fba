/*
 * @LICENSE@
 */

package org.xtgraph.regex;

/**
 * Operator record used by {@link ShuntingYard} and the {@link RpnDeque}
 * evaluators: name, arity, precedence (higher binds tighter) and
 * associativity. A unary operator is prefix when right-associative
 * (<code>-x</code>) and postfix when left-associative (<code>x*</code>).
 */
public final class Op {

    public enum Associativity {
        LEFT, RIGHT
    }

    private final String name;
    private final int arity;
    private final int precedence;
    private final Associativity associativity;

    public Op(String name, int arity, int precedence, Associativity associativity) {
        if (arity < 1) throw new IllegalArgumentException("arity: " + arity);
        this.name = name;
        this.arity = arity;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    public String name() {
        return name;
    }

    public int arity() {
        return arity;
    }

    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    public boolean isPrefix() {
        return arity == 1 && associativity == Associativity.RIGHT;
    }

    /**
     * @return true if this operator, sitting on the operator stack, must be
     *         output before <code>incoming</code> is pushed
     */
    public boolean precedes(Op incoming) {
        if (incoming.isPrefix()) return false;
        return incoming.associativity == Associativity.RIGHT
            ? precedence > incoming.precedence
            : precedence >= incoming.precedence;
    }

    @Override
    public String toString() {
        return name;
    }
}
