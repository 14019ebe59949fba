/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.PatternSyntaxException;

import org.xtgraph.automaton.Automaton;
import org.xtgraph.automaton.Determinizer;
import org.xtgraph.automaton.Nfa;
import org.xtgraph.graph.PropertyMap;

/**
 * Regular expression to automaton: tokenize, shunting-yard to postfix,
 * Thompson construction over the postfix stream, and optionally subset
 * construction.
 * <p>
 * Instances are immutable and may be shared.
 */
public final class RegexCompiler {

    private static final Logger logger = Logger.getLogger("org.xtgraph");
    private static final Level level = Level.FINER;

    /** printable ASCII, space to tilde */
    public static final SortedSet<Character> PRINTABLE;
    static {
        SortedSet<Character> s = new TreeSet<Character>();
        for (char c = ' '; c <= '~'; ++c) s.add(c);
        PRINTABLE = Collections.unmodifiableSortedSet(s);
    }

    private final RegexTokenizer tokenizer;
    private final PropertyMap<Character, String> labels;
    private final Determinizer determinizer;

    public RegexCompiler() {
        this(PRINTABLE, null);
    }

    /**
     * @param wholeAlphabet what negated sets are relative to
     * @param labels optional display label per symbol, used in log output
     */
    public RegexCompiler(SortedSet<Character> wholeAlphabet, PropertyMap<Character, String> labels) {
        this(wholeAlphabet, labels, new Determinizer());
    }

    public RegexCompiler(SortedSet<Character> wholeAlphabet,
                         PropertyMap<Character, String> labels,
                         Determinizer determinizer) {
        this.tokenizer = new RegexTokenizer(wholeAlphabet);
        this.labels = labels;
        this.determinizer = determinizer;
    }

    public PropertyMap<Character, String> labels() {
        return labels;
    }

    public List<Token> tokenize(String regex) {
        return tokenizer.tokenize(regex);
    }

    /**
     * @throws PatternSyntaxException on a malformed expression
     */
    public List<Token> postfix(String regex) {
        List<Token> ret = ShuntingYard.postfix(regex, tokenize(regex));
        if (logger.isLoggable(level)) logger.log(level, "postfix: " + ret);
        return ret;
    }

    /**
     * @throws PatternSyntaxException on a malformed expression
     */
    public Nfa compileNfa(String regex) {
        return build(regex, postfix(regex));
    }

    /**
     * Compiles a whitespace-separated postfix expression such as
     * <code>"a b |"</code>.
     */
    public Nfa compilePostfix(String postfix) {
        List<Token> tokens = ShuntingYard.parsePostfix(postfix, Operators.REGEX);
        for (int i = 0; i < tokens.size(); ++i) {
            Token t = tokens.get(i);
            if (isCountedClosure(t)) {
                RegexTokenizer.repetition(t.text(), postfix, t.position());
                tokens.set(i, Token.operator(t.text(), t.position(), Operators.REPEAT));
            }
        }
        return build(postfix, tokens);
    }

    /*
     * "{m,n}" words; the bare "{}" is the REPEAT key and must not pass
     * unchecked either
     */
    private static boolean isCountedClosure(Token t) {
        if (t.isOperator()) return t.op() == Operators.REPEAT;
        String text = t.text();
        return t.isOperand() && text.length() >= 2
            && text.charAt(0) == '{' && text.charAt(text.length() - 1) == '}';
    }

    private Nfa build(String expression, List<Token> postfix) {
        Nfa nfa = new ThompsonBuilder(expression).build(postfix);
        if (logger.isLoggable(level)) {
            logger.log(level, "nfa for /" + expression + "/: " + nfa.numVertices() + " states");
        }
        if (logger.isLoggable(Level.FINEST)) logger.log(Level.FINEST, nfa.toString(labels));
        return nfa;
    }

    /**
     * Compiles then determinizes; BOTTOM stays implicit unless the
     * determinizer is complete.
     */
    public Automaton compileDfa(String regex) {
        Automaton dfa = determinizer.determinize(compileNfa(regex));
        if (logger.isLoggable(Level.FINEST)) logger.log(Level.FINEST, dfa.toString(labels));
        return dfa;
    }

    public Ast parseAst(String regex) {
        return new AstBuilder(regex).build(postfix(regex));
    }

    /**
     * Quotes every metacharacter of <code>s</code> with a backslash.
     */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() * 2);
        for (int i = 0; i < s.length(); ++i) {
            char c = s.charAt(i);
            if (RegexTokenizer.METACHARS.indexOf(c) != -1) sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * @return a regex matching exactly <code>words</code>
     * @throws IllegalArgumentException if <code>words</code> is empty
     */
    public static String alternation(Iterable<String> words) {
        Iterator<String> it = words.iterator();
        if (!it.hasNext()) throw new IllegalArgumentException("no words");
        StringBuilder sb = new StringBuilder();
        while (it.hasNext()) {
            sb.append('(').append(escape(it.next())).append(')');
            if (it.hasNext()) sb.append('|');
        }
        return sb.toString();
    }
}
