/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.xtgraph.graph.ArrayPropertyMap;
import org.xtgraph.graph.Graph;
import org.xtgraph.graph.Misc;
import org.xtgraph.graph.PropertyMap;

/**
 * Deterministic finite automaton over <code>char</code> symbols.
 * <p>
 * States are dense integer handles <code>0..numVertices()-1</code>. The dead
 * state {@link #BOTTOM} is never materialized: every undefined transition
 * leads to it, it is not final, and it has no transitions. The first state
 * added is the initial state unless {@link #setInitial(int)} says otherwise.
 * <p>
 * Out-edges of a state are enumerated in ascending symbol order.
 */
public class Automaton implements Graph<Transition> {

    public static final int BOTTOM = -1;

    private final List<SortedMap<Character, Integer>> delta =
        new ArrayList<SortedMap<Character, Integer>>();
    private final ArrayPropertyMap<Boolean> finals = ArrayPropertyMap.withDefault(false);
    private int initial = BOTTOM;
    private int numEdges = 0;

    public int addVertex() {
        int q = delta.size();
        delta.add(new TreeMap<Character, Integer>());
        if (initial == BOTTOM) initial = q;
        return q;
    }

    public int addVertex(boolean isFinal) {
        int q = addVertex();
        setFinal(q, isFinal);
        return q;
    }

    /**
     * @throws NondeterminismException if <code>symbol</code> is epsilon or
     *             <code>q</code> already has a transition on it
     */
    public Transition addTransition(int q, char symbol, int r) {
        check(q);
        check(r);
        if (symbol == Nfa.EPSILON)
            throw new NondeterminismException("epsilon transition in a DFA", q, symbol);
        Map<Character, Integer> m = delta.get(q);
        if (m.containsKey(symbol))
            throw new NondeterminismException("transition already defined", q, symbol);
        m.put(symbol, r);
        ++numEdges;
        return new Transition(q, symbol, r);
    }

    public int initial() {
        return initial;
    }

    public void setInitial(int q) {
        check(q);
        initial = q;
    }

    public boolean isFinal(int q) {
        return q != BOTTOM && finals.get(q);
    }

    public void setFinal(int q, boolean isFinal) {
        check(q);
        finals.put(q, isFinal);
    }

    public List<Integer> finals() {
        List<Integer> ret = new ArrayList<Integer>();
        for (int q = 0; q < delta.size(); ++q) if (finals.get(q)) ret.add(q);
        return ret;
    }

    /**
     * @return the target of <code>q</code> on <code>symbol</code>, or
     *         {@link #BOTTOM}
     */
    public int delta(int q, char symbol) {
        if (q == BOTTOM) return BOTTOM;
        check(q);
        Integer r = delta.get(q).get(symbol);
        return r == null ? BOTTOM : r;
    }

    public int deltaWord(int q, CharSequence word) {
        for (int i = 0; i < word.length() && q != BOTTOM; ++i) q = delta(q, word.charAt(i));
        return q;
    }

    public boolean accepts(CharSequence word) {
        return isFinal(deltaWord(initial, word));
    }

    /**
     * @return the symbols <code>q</code> has a transition on, ascending
     */
    public SortedSet<Character> sigma(int q) {
        if (q == BOTTOM) return Collections.unmodifiableSortedSet(new TreeSet<Character>());
        check(q);
        return Collections.unmodifiableSortedSet(new TreeSet<Character>(delta.get(q).keySet()));
    }

    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (Map<Character, Integer> m : delta) ret.addAll(m.keySet());
        return ret;
    }

    /**
     * @return true if no transition leads to {@link #BOTTOM}, given the
     *         symbols this automaton uses
     */
    public boolean isComplete() {
        int n = alphabet().size();
        for (Map<Character, Integer> m : delta) if (m.size() != n) return false;
        return true;
    }

    public char label(Transition e) {
        return e.symbol;
    }

    /*
     * Graph
     */

    public Iterable<Integer> vertices() {
        List<Integer> ret = new ArrayList<Integer>(delta.size());
        for (int q = 0; q < delta.size(); ++q) ret.add(q);
        return ret;
    }

    public Iterable<Transition> edges() {
        List<Transition> ret = new ArrayList<Transition>(numEdges);
        for (int q = 0; q < delta.size(); ++q) {
            for (Transition e : outEdges(q)) ret.add(e);
        }
        return ret;
    }

    public Iterable<Transition> outEdges(int q) {
        check(q);
        List<Transition> ret = new ArrayList<Transition>();
        for (Map.Entry<Character, Integer> e : delta.get(q).entrySet()) {
            ret.add(new Transition(q, e.getKey(), e.getValue()));
        }
        return ret;
    }

    public int source(Transition e) {
        return e.source;
    }

    public int target(Transition e) {
        return e.target;
    }

    public int numVertices() {
        return delta.size();
    }

    public int numEdges() {
        return numEdges;
    }

    public boolean containsVertex(int q) {
        return q >= 0 && q < delta.size();
    }

    private void check(int q) {
        if (!containsVertex(q)) throw new IllegalArgumentException("no such state: " + q);
    }

    @Override
    public String toString() {
        return toString(null);
    }

    /**
     * @param labels optional display label per symbol
     */
    public String toString(PropertyMap<Character, String> labels) {
        StringBuilder sb = new StringBuilder();
        sb.append("DFA {").append(Misc.LS);
        for (int q = 0; q < delta.size(); ++q) {
            sb.append(q == initial ? "->" : "  ").append(q).append(isFinal(q) ? "*" : "");
            for (Map.Entry<Character, Integer> e : delta.get(q).entrySet()) {
                sb.append(' ').append(display(e.getKey(), labels)).append(":").append(e.getValue());
            }
            sb.append(Misc.LS);
        }
        return sb.append("}").toString();
    }

    static String display(char c, PropertyMap<Character, String> labels) {
        if (labels != null && labels.has(c)) return labels.get(c);
        return String.valueOf(c);
    }
}
