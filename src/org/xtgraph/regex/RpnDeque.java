/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Postfix evaluation over a deque. Operands are pushed as they come; an
 * operator pops exactly its arity of items and pushes one result. A
 * well-formed expression leaves exactly one item.
 *
 * @param <T> item type: automaton fragment, syntax tree node, number...
 */
public abstract class RpnDeque<T> {

    private final String expression;
    private final LinkedList<T> deque = new LinkedList<T>();

    /**
     * @param expression source text, for error reports only
     */
    protected RpnDeque(String expression) {
        this.expression = expression;
    }

    protected abstract T operand(Token t);

    /**
     * @param args the operator's arguments, leftmost first
     */
    protected abstract T operation(Token t, List<T> args);

    /**
     * @throws PatternSyntaxException if an operator lacks arguments
     */
    public final void push(Token t) {
        if (t.isOperand()) {
            deque.addLast(operand(t));
            return;
        }
        if (!t.isOperator()) throw syntaxError("Unexpected parenthesis", t.position());
        int arity = t.op().arity();
        if (deque.size() < arity)
            throw syntaxError("Operator arity mismatch: '" + t.text() + "' needs " + arity, t.position());
        List<T> args = new ArrayList<T>(arity);
        for (int i = 0; i < arity; ++i) args.add(0, deque.removeLast());
        deque.addLast(operation(t, args));
    }

    public final int size() {
        return deque.size();
    }

    /**
     * @throws PatternSyntaxException unless exactly one item is left
     */
    public final T result() {
        if (deque.size() != 1) {
            throw syntaxError(deque.isEmpty()
                ? "Empty expression"
                : "Malformed expression: " + deque.size() + " results", -1);
        }
        return deque.getFirst();
    }

    public final T evaluate(List<Token> postfix) {
        for (Token t : postfix) push(t);
        return result();
    }

    protected final String expression() {
        return expression;
    }

    protected final PatternSyntaxException syntaxError(String msg, int index) {
        return new PatternSyntaxException(msg, expression, index);
    }
}
