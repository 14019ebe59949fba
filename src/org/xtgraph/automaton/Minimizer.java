/*
 * @LICENSE@
 */

package org.xtgraph.automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xtgraph.graph.PreconditionException;
import org.xtgraph.graph.TopologicalSort;

/**
 * Revuz minimization of acyclic deterministic automata.
 * <p>
 * States reachable from the initial state are bucketed by height (length of
 * the longest path to a state without successors) and classified bucket by
 * bucket, lowest first, so the classes of all successors are known when a
 * state is classified. A state's signature is its final flag plus its
 * symbol-to-class transitions; states with equal signatures are equivalent.
 * Non-final states without transitions (after dropping those into the dead
 * class) are the dead class itself and are not materialized.
 * <p>
 * Each class is represented by its smallest original state. The result is a
 * new automaton, numbered breadth-first from the initial state with symbols
 * ascending; the input is left untouched.
 */
public final class Minimizer {

    private static final Logger logger = Logger.getLogger("org.xtgraph");
    private static final Level level = Level.FINER;

    /**
     * Notified once per state folded into another, after classification.
     */
    public interface Visitor {
        void statesMerged(int representative, int merged);
    }

    private static final int DEAD = -1;

    private Minimizer() {
    }

    public static Automaton minimize(Automaton dfa) {
        return minimize(dfa, null);
    }

    /**
     * @param vis optional
     * @throws PreconditionException if the reachable part of <code>dfa</code>
     *             has a cycle
     */
    public static Automaton minimize(Automaton dfa, Visitor vis) {
        if (dfa.initial() == Automaton.BOTTOM) return emptyLanguage();

        List<Integer> order = TopologicalSort.sort(dfa, Collections.singleton(dfa.initial()));

        Map<Integer, Integer> height = new HashMap<Integer, Integer>();
        for (int i = order.size() - 1; i >= 0; --i) {
            int q = order.get(i);
            int h = 0;
            for (Transition e : dfa.outEdges(q)) h = Math.max(h, height.get(e.target) + 1);
            height.put(q, h);
        }
        SortedMap<Integer, List<Integer>> buckets = new TreeMap<Integer, List<Integer>>();
        for (int q : order) {
            List<Integer> bucket = buckets.get(height.get(q));
            if (bucket == null) buckets.put(height.get(q), bucket = new ArrayList<Integer>());
            bucket.add(q);
        }

        Map<Integer, Integer> classOf = new HashMap<Integer, Integer>();
        Map<Signature, Integer> classes = new HashMap<Signature, Integer>();
        List<List<Integer>> members = new ArrayList<List<Integer>>();
        for (List<Integer> bucket : buckets.values()) {
            Collections.sort(bucket);
            for (int q : bucket) {
                Signature sig = new Signature(dfa.isFinal(q));
                for (Transition e : dfa.outEdges(q)) {
                    int c = classOf.get(e.target);
                    if (c != DEAD) sig.delta.put(e.symbol, c);
                }
                if (!sig.isFinal && sig.delta.isEmpty()) {
                    classOf.put(q, DEAD);
                    continue;
                }
                Integer c = classes.get(sig);
                if (c == null) {
                    classes.put(sig, c = members.size());
                    members.add(new ArrayList<Integer>());
                }
                classOf.put(q, c);
                members.get(c).add(q);
            }
        }

        int merged = 0;
        int[] representative = new int[members.size()];
        for (int c = 0; c < members.size(); ++c) {
            List<Integer> m = members.get(c);
            representative[c] = Collections.min(m);
            for (int q : m) {
                if (q == representative[c]) continue;
                ++merged;
                if (vis != null) vis.statesMerged(representative[c], q);
            }
        }

        int c0 = classOf.get(dfa.initial());
        if (c0 == DEAD) return emptyLanguage();
        Automaton ret = build(dfa, c0, classOf, representative);

        if (logger.isLoggable(level)) {
            logger.log(level, "minimized: " + dfa.numVertices() + " -> " + ret.numVertices()
                + " states, " + merged + " merged");
        }
        return ret;
    }

    private static Automaton build(Automaton dfa, int c0, Map<Integer, Integer> classOf,
                                   int[] representative) {
        Automaton ret = new Automaton();
        Map<Integer, Integer> number = new HashMap<Integer, Integer>();
        LinkedList<Integer> queue = new LinkedList<Integer>();
        number.put(c0, ret.addVertex(dfa.isFinal(representative[c0])));
        queue.addLast(c0);
        while (!queue.isEmpty()) {
            int c = queue.removeFirst();
            for (Transition e : dfa.outEdges(representative[c])) {
                int d = classOf.get(e.target);
                if (d == DEAD) continue;
                Integer r = number.get(d);
                if (r == null) {
                    number.put(d, r = ret.addVertex(dfa.isFinal(representative[d])));
                    queue.addLast(d);
                }
                ret.addTransition(number.get(c), e.symbol, r);
            }
        }
        return ret;
    }

    private static Automaton emptyLanguage() {
        Automaton ret = new Automaton();
        ret.addVertex(false);
        return ret;
    }

    private static final class Signature {
        final boolean isFinal;
        final SortedMap<Character, Integer> delta = new TreeMap<Character, Integer>();

        Signature(boolean isFinal) {
            this.isFinal = isFinal;
        }

        @Override
        public int hashCode() {
            return delta.hashCode() * 2 + (isFinal ? 1 : 0);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Signature)) return false;
            Signature other = (Signature) obj;
            return isFinal == other.isFinal && delta.equals(other.delta);
        }
    }
}
