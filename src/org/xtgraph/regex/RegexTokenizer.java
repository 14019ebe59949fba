/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;

import org.xtgraph.automaton.Nfa;

/**
 * Splits a regular expression into infix tokens and makes implicit
 * concatenation explicit.
 * <p>
 * Supported: literals, <code>. | * + ?</code>, groups, counted closures
 * <code>{m} {m,} {,n} {m,n}</code>, bracket sets with ranges and
 * <code>[^...]</code> negation, <code>\d \D \s \S \w \W</code>, control
 * escapes <code>\a \b \f \n \r \t \v</code>, and escaped metacharacters.
 * Note that <code>.</code> is explicit concatenation, not a wildcard.
 * Negation is relative to the whole alphabet given at construction.
 */
public final class RegexTokenizer {

    /** characters {@link RegexCompiler#escape(String)} quotes */
    static final String METACHARS = "|[]{}.+*?()^$\\";

    private static final String ESCAPABLE = METACHARS + "-";

    private final SortedSet<Character> wholeAlphabet;

    public RegexTokenizer(SortedSet<Character> wholeAlphabet) {
        this.wholeAlphabet = new TreeSet<Character>(wholeAlphabet);
        this.wholeAlphabet.remove(Nfa.EPSILON);
    }

    /**
     * @throws PatternSyntaxException on a malformed bracket set, counted
     *             closure or escape
     */
    public List<Token> tokenize(String regex) {
        return catify(new Scanner(regex).run());
    }

    /*
     * inserts CONCAT between anything that ends an operand and anything that
     * starts one
     */
    static List<Token> catify(List<Token> infix) {
        List<Token> ret = new ArrayList<Token>(infix.size() * 2);
        Token prev = null;
        for (Token t : infix) {
            if (prev != null && endsOperand(prev) && startsOperand(t)) {
                ret.add(Token.operator(Operators.CONCAT.name(), -1, Operators.CONCAT));
            }
            ret.add(t);
            prev = t;
        }
        return ret;
    }

    private static boolean endsOperand(Token t) {
        switch (t.kind()) {
        case OPERAND:
        case RIGHT_PAREN:
            return true;
        case OPERATOR:
            return t.op().arity() == 1 && !t.op().isPrefix();
        default:
            return false;
        }
    }

    private static boolean startsOperand(Token t) {
        return t.kind() == Token.Kind.OPERAND || t.kind() == Token.Kind.LEFT_PAREN;
    }

    /**
     * @param text a counted closure, <code>"{2,5}"</code>
     * @return {min, max}, max == -1 when unbounded
     */
    static int[] bounds(String text) {
        String body = text.substring(1, text.length() - 1);
        int comma = body.indexOf(',');
        if (comma == -1) {
            int m = Integer.parseInt(body);
            return new int[] { m, m };
        }
        String lo = body.substring(0, comma), hi = body.substring(comma + 1);
        return new int[] {
            lo.length() == 0 ? 0 : Integer.parseInt(lo),
            hi.length() == 0 ? -1 : Integer.parseInt(hi) };
    }

    /**
     * Checks a counted closure written as <code>text</code> at
     * <code>index</code> of <code>expression</code>.
     *
     * @return {min, max} as {@link #bounds(String)}
     * @throws PatternSyntaxException if the body or the range is illegal
     */
    static int[] repetition(String text, String expression, int index) {
        String body = text.substring(1, text.length() - 1);
        if (!body.matches("\\d+|\\d+,\\d*|,\\d+")) {
            throw new PatternSyntaxException("Illegal repetition", expression, index);
        }
        int[] b;
        try {
            b = bounds(text);
        } catch (NumberFormatException e) {
            throw new PatternSyntaxException("Illegal repetition", expression, index);
        }
        if (b[1] != -1 && b[1] < b[0]) {
            throw new PatternSyntaxException("Illegal repetition range", expression, index);
        }
        return b;
    }

    private final class Scanner {

        private final String regex;
        private final int n;
        private int iCurrent = 0;
        private final List<Token> tokens = new ArrayList<Token>();

        Scanner(String regex) {
            this.regex = regex;
            this.n = regex.length();
        }

        List<Token> run() {
            while (iCurrent < n) {
                int start = iCurrent;
                char c = regex.charAt(iCurrent++);
                switch (c) {
                case '(':
                    if (iCurrent < n && regex.charAt(iCurrent) == ')') {
                        ++iCurrent;
                        tokens.add(Token.epsilon(start));
                    } else {
                        tokens.add(Token.leftParen(start));
                    }
                    break;
                case ')':
                    tokens.add(Token.rightParen(start));
                    break;
                case '|':
                case '*':
                case '+':
                case '?':
                case '.':
                    tokens.add(Token.operator(String.valueOf(c), start,
                        Operators.REGEX.get(String.valueOf(c))));
                    break;
                case '{':
                    countedClosure(start);
                    break;
                case '[':
                    operand(start, bracket(start));
                    break;
                case '\\':
                    operand(start, escape());
                    break;
                default:
                    operand(start, single(c, start));
                    break;
                }
            }
            return tokens;
        }

        private void operand(int start, SortedSet<Character> symbols) {
            tokens.add(Token.operand(regex.substring(start, iCurrent), start, symbols));
        }

        private void countedClosure(int start) {
            int close = regex.indexOf('}', iCurrent);
            if (close == -1) syntaxError("Unclosed counted closure", start);
            iCurrent = close + 1;
            String text = regex.substring(start, iCurrent);
            repetition(text, regex, start);
            tokens.add(Token.operator(text, start, Operators.REPEAT));
        }

        private SortedSet<Character> bracket(int start) {
            SortedSet<Character> set = new TreeSet<Character>();
            boolean negate = false;
            if (iCurrent < n && regex.charAt(iCurrent) == '^') {
                negate = true;
                ++iCurrent;
            }
            for (boolean first = true;; first = false) {
                if (iCurrent >= n) syntaxError("Unclosed character class", start);
                char c = regex.charAt(iCurrent++);
                if (c == ']' && !first) break;
                char lo;
                if (c == '\\') {
                    SortedSet<Character> e = escape();
                    if (e.size() != 1) {
                        set.addAll(e);
                        continue;
                    }
                    lo = e.first();
                } else {
                    lo = single(c, iCurrent - 1).first();
                }
                if (iCurrent + 1 < n && regex.charAt(iCurrent) == '-' && regex.charAt(iCurrent + 1) != ']') {
                    ++iCurrent;
                    char hi = regex.charAt(iCurrent++);
                    if (hi == '\\') {
                        SortedSet<Character> e = escape();
                        if (e.size() != 1) syntaxError("Illegal character range", iCurrent - 1);
                        hi = e.first();
                    }
                    if (hi < lo) syntaxError("Illegal character range", iCurrent - 1);
                    for (char x = lo;; ++x) {
                        set.add(x);
                        if (x == hi) break;
                    }
                } else {
                    set.add(lo);
                }
            }
            set.remove(Nfa.EPSILON);
            return negate ? complement(set) : set;
        }

        private SortedSet<Character> escape() {
            if (iCurrent >= n) syntaxError("Dangling backslash", n - 1);
            char c = regex.charAt(iCurrent++);
            switch (c) {
            case 'd': return digits();
            case 'D': return complement(digits());
            case 's': return spaces();
            case 'S': return complement(spaces());
            case 'w': return word();
            case 'W': return complement(word());
            case 'a': return single('\u0007', iCurrent - 1);
            case 'b': return single('\b', iCurrent - 1);
            case 'f': return single('\f', iCurrent - 1);
            case 'n': return single('\n', iCurrent - 1);
            case 'r': return single('\r', iCurrent - 1);
            case 't': return single('\t', iCurrent - 1);
            case 'v': return single('\u000b', iCurrent - 1);
            default:
                if (ESCAPABLE.indexOf(c) == -1)
                    syntaxError("Illegal or unsupported escape sequence", iCurrent - 2);
                return single(c, iCurrent - 1);
            }
        }

        private SortedSet<Character> single(char c, int index) {
            if (c == Nfa.EPSILON) syntaxError("Reserved symbol", index);
            SortedSet<Character> ret = new TreeSet<Character>();
            ret.add(c);
            return ret;
        }

        private SortedSet<Character> complement(SortedSet<Character> set) {
            SortedSet<Character> ret = new TreeSet<Character>(wholeAlphabet);
            ret.removeAll(set);
            return ret;
        }

        private void syntaxError(String msg, int index) {
            throw new PatternSyntaxException(msg, regex, index);
        }
    }

    private static SortedSet<Character> range(SortedSet<Character> set, char lo, char hi) {
        for (char c = lo; c <= hi; ++c) set.add(c);
        return set;
    }

    private static SortedSet<Character> digits() {
        return range(new TreeSet<Character>(), '0', '9');
    }

    private static SortedSet<Character> spaces() {
        SortedSet<Character> ret = new TreeSet<Character>();
        ret.add(' ');
        ret.add('\t');
        return ret;
    }

    private static SortedSet<Character> word() {
        return range(range(digits(), 'A', 'Z'), 'a', 'z');
    }
}
