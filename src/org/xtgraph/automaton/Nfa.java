/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedList;
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
 * Non-deterministic finite automaton with epsilon transitions and any number
 * of initial states. States are dense integer handles, as in
 * {@link Automaton}.
 * <p>
 * {@link #EPSILON} is reserved: it can't be used as an input symbol.
 */
public class Nfa implements Graph<Transition> {

    public static final char EPSILON = '\u03b5';

    private final List<SortedMap<Character, SortedSet<Integer>>> delta =
        new ArrayList<SortedMap<Character, SortedSet<Integer>>>();
    private final ArrayPropertyMap<Boolean> finals = ArrayPropertyMap.withDefault(false);
    private final SortedSet<Integer> initials = new TreeSet<Integer>();
    private int numEdges = 0;

    /**
     * Copies a DFA; its initial state becomes the only initial state.
     */
    public static Nfa from(Automaton dfa) {
        Nfa nfa = new Nfa();
        for (int q : dfa.vertices()) nfa.addVertex(dfa.isFinal(q));
        for (Transition e : dfa.edges()) nfa.addTransition(e.source, e.symbol, e.target);
        if (dfa.initial() != Automaton.BOTTOM) nfa.setInitial(dfa.initial(), true);
        return nfa;
    }

    public int addVertex() {
        delta.add(new TreeMap<Character, SortedSet<Integer>>());
        return delta.size() - 1;
    }

    public int addVertex(boolean isFinal) {
        int q = addVertex();
        setFinal(q, isFinal);
        return q;
    }

    /**
     * Adding a transition twice is harmless.
     */
    public void addTransition(int q, char symbol, int r) {
        check(q);
        check(r);
        SortedMap<Character, SortedSet<Integer>> m = delta.get(q);
        SortedSet<Integer> targets = m.get(symbol);
        if (targets == null) m.put(symbol, targets = new TreeSet<Integer>());
        if (targets.add(r)) ++numEdges;
    }

    public void addEpsilon(int q, int r) {
        addTransition(q, EPSILON, r);
    }

    public SortedSet<Integer> initials() {
        return Collections.unmodifiableSortedSet(initials);
    }

    public void setInitial(int q, boolean isInitial) {
        check(q);
        if (isInitial) initials.add(q);
        else initials.remove(q);
    }

    public boolean isFinal(int q) {
        return q != Automaton.BOTTOM && finals.get(q);
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
     * @return the states reachable from <code>states</code> through epsilon
     *         transitions only, <code>states</code> included
     */
    public SortedSet<Integer> epsilonClosure(Collection<Integer> states) {
        SortedSet<Integer> ret = new TreeSet<Integer>(states);
        LinkedList<Integer> todo = new LinkedList<Integer>(states);
        while (!todo.isEmpty()) {
            int q = todo.removeFirst();
            check(q);
            SortedSet<Integer> targets = delta.get(q).get(EPSILON);
            if (targets == null) continue;
            for (int r : targets) if (ret.add(r)) todo.addLast(r);
        }
        return ret;
    }

    public SortedSet<Integer> epsilonClosure(int q) {
        return epsilonClosure(Collections.singleton(q));
    }

    /**
     * @return the targets of one <code>symbol</code> step from any of
     *         <code>states</code>, without epsilon closure
     */
    public SortedSet<Integer> deltaOneStep(Collection<Integer> states, char symbol) {
        SortedSet<Integer> ret = new TreeSet<Integer>();
        for (int q : states) {
            check(q);
            SortedSet<Integer> targets = delta.get(q).get(symbol);
            if (targets != null) ret.addAll(targets);
        }
        return ret;
    }

    /**
     * Epsilon-closes <code>states</code>, steps on <code>symbol</code>, and
     * epsilon-closes the result. An empty result stands for BOTTOM.
     */
    public SortedSet<Integer> delta(Collection<Integer> states, char symbol) {
        return epsilonClosure(deltaOneStep(epsilonClosure(states), symbol));
    }

    public SortedSet<Integer> deltaWord(Collection<Integer> states, CharSequence word) {
        SortedSet<Integer> ret = epsilonClosure(states);
        for (int i = 0; i < word.length() && !ret.isEmpty(); ++i) {
            ret = delta(ret, word.charAt(i));
        }
        return ret;
    }

    public boolean accepts(CharSequence word) {
        for (int q : deltaWord(initials, word)) if (isFinal(q)) return true;
        return false;
    }

    /**
     * @return the symbols <code>q</code> has transitions on, epsilon included
     */
    public SortedSet<Character> sigma(int q) {
        check(q);
        return Collections.unmodifiableSortedSet(new TreeSet<Character>(delta.get(q).keySet()));
    }

    /**
     * @return every input symbol used, epsilon excluded
     */
    public SortedSet<Character> alphabet() {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (Map<Character, SortedSet<Integer>> m : delta) ret.addAll(m.keySet());
        ret.remove(EPSILON);
        return ret;
    }

    public boolean isDeterministic() {
        try {
            checkDeterministic();
            return true;
        } catch (NondeterminismException e) {
            return false;
        }
    }

    /**
     * @throws NondeterminismException naming the first offending state and
     *             symbol, if there is more than one initial state, an epsilon
     *             transition, or two transitions on the same symbol
     */
    public void checkDeterministic() {
        if (initials.size() > 1)
            throw new NondeterminismException("multiple initial states", initials.last(), EPSILON);
        for (int q = 0; q < delta.size(); ++q) {
            for (Map.Entry<Character, SortedSet<Integer>> e : delta.get(q).entrySet()) {
                if (e.getKey() == EPSILON)
                    throw new NondeterminismException("epsilon transition", q, EPSILON);
                if (e.getValue().size() > 1)
                    throw new NondeterminismException("ambiguous transition", q, e.getKey());
            }
        }
    }

    /**
     * Direct conversion of a deterministic NFA; state handles are kept.
     *
     * @throws NondeterminismException if this NFA is not deterministic
     */
    public Automaton toAutomaton() {
        checkDeterministic();
        Automaton dfa = new Automaton();
        for (int q = 0; q < delta.size(); ++q) dfa.addVertex(isFinal(q));
        for (Transition e : edges()) dfa.addTransition(e.source, e.symbol, e.target);
        if (!initials.isEmpty()) dfa.setInitial(initials.first());
        return dfa;
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
        for (Map.Entry<Character, SortedSet<Integer>> e : delta.get(q).entrySet()) {
            for (int r : e.getValue()) ret.add(new Transition(q, e.getKey(), r));
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

    public String toString(PropertyMap<Character, String> labels) {
        StringBuilder sb = new StringBuilder();
        sb.append("NFA {").append(Misc.LS);
        for (int q = 0; q < delta.size(); ++q) {
            sb.append(initials.contains(q) ? "->" : "  ").append(q).append(isFinal(q) ? "*" : "");
            for (Map.Entry<Character, SortedSet<Integer>> e : delta.get(q).entrySet()) {
                sb.append(' ').append(Automaton.display(e.getKey(), labels)).append(":").append(e.getValue());
            }
            sb.append(Misc.LS);
        }
        return sb.append("}").toString();
    }
}
