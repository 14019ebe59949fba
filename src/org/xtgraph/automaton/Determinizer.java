/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtgraph.graph.ArrayPropertyMap;
import org.xtgraph.graph.BreadthFirstSearch;
import org.xtgraph.graph.Color;
import org.xtgraph.graph.Graph;
import org.xtgraph.graph.GraphVisitor;

/**
 * Subset construction. Each DFA state stands for an epsilon-closed set of NFA
 * states; the DFA is explored breadth-first while it is being built, and the
 * transitions of a state are computed when it is examined, symbols
 * ascending. State numbering therefore follows discovery order.
 * <p>
 * The empty subset is {@link Automaton#BOTTOM} and is left implicit, unless
 * the determinizer is <i>complete</i>, in which case it becomes an explicit
 * non-final sink looping on the whole NFA alphabet.
 * <p>
 * Worst case is exponential in the number of NFA states. Construction stops
 * with a {@link ConstructionException} past <code>maxStates</code> DFA
 * states; the default comes from the system property
 * {@value #MAX_STATES_PROPERTY} (100000 if unset).
 */
public final class Determinizer {

    private static final Logger logger = Logger.getLogger("org.xtgraph");
    private static final Level level = Level.FINER;

    public static final String MAX_STATES_PROPERTY = "org.xtgraph.determinize.maxStates";
    public static final int DEFAULT_MAX_STATES = 100000;

    private final int maxStates;
    private final boolean complete;

    public Determinizer() {
        this(Integer.getInteger(MAX_STATES_PROPERTY, DEFAULT_MAX_STATES), false);
    }

    public Determinizer(int maxStates, boolean complete) {
        if (maxStates < 1) throw new IllegalArgumentException("maxStates: " + maxStates);
        this.maxStates = maxStates;
        this.complete = complete;
    }

    public int maxStates() {
        return maxStates;
    }

    public boolean isComplete() {
        return complete;
    }

    public Automaton determinize(Automaton dfa) {
        return determinize(Nfa.from(dfa));
    }

    public Automaton determinize(final Nfa nfa) {
        final Automaton dfa = new Automaton();
        final Map<SortedSet<Integer>, Integer> stateFactory =
            new LinkedHashMap<SortedSet<Integer>, Integer>();
        final List<SortedSet<Integer>> subsets = new ArrayList<SortedSet<Integer>>();
        final SortedSet<Character> alphabet = nfa.alphabet();

        int q0 = newState(nfa.epsilonClosure(nfa.initials()), nfa, dfa, stateFactory, subsets);
        BreadthFirstSearch.search(dfa,
            Collections.singleton(q0),
            ArrayPropertyMap.<Color>withDefault(Color.WHITE),
            new GraphVisitor<Transition>() {
                @Override
                public void examineVertex(int q, Graph<Transition> g) {
                    SortedSet<Integer> subset = subsets.get(q);
                    for (char a : complete ? alphabet : symbolsOf(nfa, subset)) {
                        SortedSet<Integer> target = nfa.delta(subset, a);
                        if (target.isEmpty() && !complete) continue;
                        Integer r = stateFactory.get(target);
                        if (r == null) r = newState(target, nfa, dfa, stateFactory, subsets);
                        dfa.addTransition(q, a, r);
                    }
                }
            },
            null);

        if (logger.isLoggable(level)) {
            logger.log(level, "determinized: " + nfa.numVertices() + " NFA states -> "
                + dfa.numVertices() + " DFA states");
        }
        if (logger.isLoggable(Level.FINEST)) logger.log(Level.FINEST, dfa.toString());
        return dfa;
    }

    private int newState(SortedSet<Integer> subset,
                         Nfa nfa,
                         Automaton dfa,
                         Map<SortedSet<Integer>, Integer> stateFactory,
                         List<SortedSet<Integer>> subsets) {
        if (dfa.numVertices() >= maxStates) {
            throw new ConstructionException(
                "subset construction exceeded " + maxStates + " states");
        }
        boolean isFinal = false;
        for (int s : subset) if (nfa.isFinal(s)) { isFinal = true; break; }
        int q = dfa.addVertex(isFinal);
        assert q == subsets.size();
        subsets.add(subset);
        stateFactory.put(subset, q);
        return q;
    }

    /*
     * input symbols leaving any state of the subset, ascending
     */
    private static SortedSet<Character> symbolsOf(Nfa nfa, SortedSet<Integer> subset) {
        SortedSet<Character> ret = new TreeSet<Character>();
        for (int s : subset) ret.addAll(nfa.sigma(s));
        ret.remove(Nfa.EPSILON);
        return ret;
    }
}
