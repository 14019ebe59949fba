/*
 * @LICENSE@
 */

/**
 * Finite automata as graphs whose edges carry symbols: {@link
 * org.xtgraph.automaton.Nfa} (epsilon transitions, several initial states),
 * {@link org.xtgraph.automaton.Automaton} (deterministic, with an implicit
 * dead state), subset construction ({@link
 * org.xtgraph.automaton.Determinizer}) and minimization of acyclic automata
 * ({@link org.xtgraph.automaton.Minimizer}).
 * <p>
 * Every transformation builds a new automaton and leaves its input alone.
 */
package org.xtgraph.automaton;
