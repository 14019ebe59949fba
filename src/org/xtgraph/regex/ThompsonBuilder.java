/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.List;

import org.xtgraph.automaton.Determinizer;
import org.xtgraph.automaton.Nfa;
import org.xtgraph.automaton.Transition;

/**
 * Thompson construction as a postfix evaluation. Every item is a fragment of
 * one shared NFA with a single entry and a single exit; since the postfix
 * form of a subexpression is contiguous, so are the states of its fragment,
 * which makes copying a fragment (for counted closures) a matter of
 * offsetting a state range.
 */
final class ThompsonBuilder extends RpnDeque<ThompsonBuilder.Fragment> {

    static final class Fragment {
        final int lo, hi;  // states [lo, hi)
        final int q0, f;

        Fragment(int lo, int hi, int q0, int f) {
            this.lo = lo;
            this.hi = hi;
            this.q0 = q0;
            this.f = f;
        }
    }

    private final Nfa nfa = new Nfa();

    /** counted closures may not expand past this many states */
    private final int maxStates =
        Integer.getInteger(Determinizer.MAX_STATES_PROPERTY, Determinizer.DEFAULT_MAX_STATES);

    ThompsonBuilder(String expression) {
        super(expression);
    }

    /**
     * An empty postfix stream yields the automaton of the empty word.
     */
    Nfa build(List<Token> postfix) {
        if (postfix.isEmpty()) {
            nfa.setInitial(nfa.addVertex(true), true);
            return nfa;
        }
        Fragment fr = evaluate(postfix);
        nfa.setInitial(fr.q0, true);
        nfa.setFinal(fr.f, true);
        return nfa;
    }

    @Override
    protected Fragment operand(Token t) {
        int lo = nfa.numVertices();
        int q0 = nfa.addVertex();
        if (t.isEpsilon()) {
            int f = nfa.addVertex();
            nfa.addEpsilon(q0, f);
            return fragment(lo, q0, f);
        }
        if (t.symbols() != null) {
            int f = nfa.addVertex();
            for (char c : t.symbols()) nfa.addTransition(q0, c, f);
            return fragment(lo, q0, f);
        }
        // multi-character word from a postfix string
        int q = q0;
        for (int i = 0; i < t.text().length(); ++i) {
            int r = nfa.addVertex();
            nfa.addTransition(q, t.text().charAt(i), r);
            q = r;
        }
        return fragment(lo, q0, q);
    }

    @Override
    protected Fragment operation(Token t, List<Fragment> args) {
        Op op = t.op();
        Fragment a = args.get(0);
        if (op == Operators.CONCAT) return concat(a, args.get(1));
        if (op == Operators.UNION) return union(a, args.get(1));
        if (op == Operators.STAR) return star(a);
        if (op == Operators.PLUS) return plus(a);
        if (op == Operators.OPTIONAL) return optional(a);
        if (op == Operators.REPEAT) {
            int[] b = RegexTokenizer.bounds(t.text());
            long copies = b[1] == -1 ? b[0] + 1L : b[1];
            if (copies * (a.hi - a.lo) > maxStates) {
                throw syntaxError("Counted closure exceeds " + maxStates + " states", t.position());
            }
            return repeat(a, b[0], b[1]);
        }
        throw syntaxError("Unsupported operator '" + t.text() + "'", t.position());
    }

    private Fragment fragment(int lo, int q0, int f) {
        return new Fragment(lo, nfa.numVertices(), q0, f);
    }

    private Fragment concat(Fragment a, Fragment b) {
        nfa.addEpsilon(a.f, b.q0);
        return fragment(a.lo, a.q0, b.f);
    }

    private Fragment union(Fragment a, Fragment b) {
        int q0 = nfa.addVertex(), f = nfa.addVertex();
        nfa.addEpsilon(q0, a.q0);
        nfa.addEpsilon(q0, b.q0);
        nfa.addEpsilon(a.f, f);
        nfa.addEpsilon(b.f, f);
        return fragment(a.lo, q0, f);
    }

    private Fragment star(Fragment a) {
        int q0 = nfa.addVertex(), f = nfa.addVertex();
        nfa.addEpsilon(q0, a.q0);
        nfa.addEpsilon(q0, f);
        nfa.addEpsilon(a.f, a.q0);
        nfa.addEpsilon(a.f, f);
        return fragment(a.lo, q0, f);
    }

    private Fragment plus(Fragment a) {
        int f = nfa.addVertex();
        nfa.addEpsilon(a.f, a.q0);
        nfa.addEpsilon(a.f, f);
        return fragment(a.lo, a.q0, f);
    }

    private Fragment optional(Fragment a) {
        int q0 = nfa.addVertex(), f = nfa.addVertex();
        nfa.addEpsilon(q0, a.q0);
        nfa.addEpsilon(q0, f);
        nfa.addEpsilon(a.f, f);
        return fragment(a.lo, q0, f);
    }

    /*
     * a{m,max}: m mandatory copies, then (max - m) optional ones, or a
     * starred one when max == -1
     */
    private Fragment repeat(Fragment a, int m, int max) {
        int copies = max == -1 ? m + 1 : max;
        if (copies == 0) {
            int q0 = nfa.addVertex(), f = nfa.addVertex();
            nfa.addEpsilon(q0, f);
            return fragment(a.lo, q0, f);
        }
        List<Fragment> parts = new ArrayList<Fragment>(copies);
        parts.add(a);
        for (int k = 1; k < copies; ++k) parts.add(copy(a));
        Fragment ret = null;
        for (int k = 0; k < copies; ++k) {
            Fragment part = parts.get(k);
            if (k >= m) part = max == -1 ? star(part) : optional(part);
            ret = ret == null ? part : concat(ret, part);
        }
        return fragment(a.lo, ret.q0, ret.f);
    }

    private Fragment copy(Fragment a) {
        int offset = nfa.numVertices() - a.lo;
        for (int q = a.lo; q < a.hi; ++q) nfa.addVertex();
        for (int q = a.lo; q < a.hi; ++q) {
            for (Transition e : nfa.outEdges(q)) {
                assert e.target() >= a.lo && e.target() < a.hi : e;
                nfa.addTransition(q + offset, e.symbol(), e.target() + offset);
            }
        }
        return new Fragment(a.lo + offset, a.hi + offset, a.q0 + offset, a.f + offset);
    }
}
