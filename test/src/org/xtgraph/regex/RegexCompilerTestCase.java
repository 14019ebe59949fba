/* @LICENSE@
 */

package org.xtgraph.regex;

import static org.xtgraph.automaton.AutomatonAssert.*;

import java.util.Arrays;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;

import org.xtgraph.AbstractGraphTestCase;
import org.xtgraph.automaton.Automaton;
import org.xtgraph.automaton.Determinizer;
import org.xtgraph.automaton.Minimizer;
import org.xtgraph.automaton.Nfa;
import org.xtgraph.graph.AssocPropertyMap;

public class RegexCompilerTestCase extends AbstractGraphTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(RegexCompilerTestCase.class);
    }

    public RegexCompilerTestCase(String name) {
        super(name);
    }

    private final RegexCompiler compiler = new RegexCompiler();

    private void assertRegex(String regex, String alphabet, int maxLength, String... language) {
        Automaton dfa = compiler.compileDfa(regex);
        assertLanguage(dfa, set(language), alphabet, maxLength);
        assertLanguage(compiler.compileNfa(regex), set(language), alphabet, maxLength);
    }

    private void assertSyntaxError(String regex, int index) {
        try {
            compiler.compileNfa(regex);
            fail(regex);
        } catch (PatternSyntaxException e) {
            assertEquals(regex + ": " + e.getDescription(), index, e.getIndex());
        }
    }

    public void testUnion() {
        assertRegex("a|b", "abc", 3, "a", "b");
    }

    public void testStar() {
        Automaton dfa = compiler.compileDfa("ab*");
        for (String w : Arrays.asList("a", "ab", "abb", "abbbbbb")) assertTrue(w, dfa.accepts(w));
        for (String w : Arrays.asList("", "b", "ba", "aab")) assertFalse(w, dfa.accepts(w));
        assertEquals(3, dfa.numVertices());
    }

    public void testOperators() {
        assertRegex("a+", "ab", 3, "a", "aa", "aaa");
        assertRegex("ab?", "ab", 3, "a", "ab");
        assertRegex("(ab)*", "ab", 4, "", "ab", "abab");
        assertRegex("a.b", "ab.", 3, "ab");
        assertRegex("", "ab", 2, "");
        assertRegex("()", "ab", 2, "");
        assertRegex("a()b", "ab", 3, "ab");
    }

    public void testCountedClosures() {
        assertRegex("a{2}", "a", 4, "aa");
        assertRegex("a{1,3}", "a", 5, "a", "aa", "aaa");
        assertRegex("a{2,}", "a", 5, "aa", "aaa", "aaaa", "aaaaa");
        assertRegex("a{,2}", "a", 4, "", "a", "aa");
        assertRegex("(ab){0}", "ab", 2, "");
        assertRegex("(a|b){2}", "ab", 3, "aa", "ab", "ba", "bb");
        assertRegex("x(ab?){2}", "abx", 5, "xaa", "xaab", "xaba", "xabab");
    }

    public void testBrackets() {
        assertRegex("[a-c]x", "abcdx", 2, "ax", "bx", "cx");
        assertRegex("[]a]", "]ab", 1, "]", "a");
        assertRegex("[a-]", "a-b", 1, "a", "-");
        assertRegex("[\\d.]", "5.a", 1, "5", ".");
        Automaton dfa = compiler.compileDfa("[^a]");
        assertTrue(dfa.accepts("b"));
        assertTrue(dfa.accepts("~"));
        assertFalse(dfa.accepts("a"));
        assertFalse(dfa.accepts("\t"));
        assertEquals(RegexCompiler.PRINTABLE.size() - 1, dfa.numEdges());
    }

    public void testEscapes() {
        assertRegex("\\d+", "0a", 2, "0", "00");
        assertRegex("\\w", "a_Z9", 1, "a", "Z", "9");
        assertRegex("\\s\\S", " \tx", 2, " x", "\tx");
        assertRegex("\\t\\n", "\t\n", 2, "\t\n");
        assertRegex("\\(\\*\\)", "(*)", 3, "(*)");
        assertFalse(compiler.compileDfa("\\D").accepts("7"));
    }

    public void testWholeAlphabet() {
        SortedSet<Character> abc = new TreeSet<Character>(Arrays.asList('a', 'b', 'c'));
        RegexCompiler small = new RegexCompiler(abc, null);
        assertLanguage(small.compileDfa("[^a]"), set("b", "c"), "abcd", 1);
        assertLanguage(small.compileDfa("\\W"), set(), "abc", 1);
    }

    public void testEscapeRoundTrip() {
        String literal = "(x)|y*.[z]{1}\\";
        String escaped = RegexCompiler.escape(literal);
        assertEquals("\\(x\\)\\|y\\*\\.\\[z\\]\\{1\\}\\\\", escaped);
        Automaton dfa = compiler.compileDfa(escaped);
        assertTrue(dfa.accepts(literal));
        assertFalse(dfa.accepts("x"));
    }

    public void testFiniteLanguageRoundTrip() {
        List<String> words = Arrays.asList("", "a", "ab", "b.c", "x*y", "abab");
        Automaton dfa = compiler.compileDfa(RegexCompiler.alternation(words));
        Automaton min = Minimizer.minimize(dfa);
        assertLanguage(min, words, "ab.cx*y", 4);
        assertTrue(min.numVertices() <= dfa.numVertices());
        assertEquals(min.numVertices(), Minimizer.minimize(min).numVertices());
    }

    public void testPostfixEvaluation() {
        Nfa nfa = compiler.compilePostfix("a b |");
        assertLanguage(nfa, set("a", "b"), "ab", 2);
        assertLanguage(compiler.compilePostfix("ab c ."), set("abc"), "abc", 3);
        try {
            compiler.compilePostfix("a |");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(2, e.getIndex());
        }
        try {
            compiler.compilePostfix("a b");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(-1, e.getIndex());
        }
    }

    public void testPostfixCountedClosures() {
        assertLanguage(compiler.compilePostfix("a {2}"), set("aa"), "a", 4);
        assertLanguage(compiler.compilePostfix("a b | {1,2}"),
                set("a", "b", "aa", "ab", "ba", "bb"), "ab", 3);
        assertLanguage(compiler.compilePostfix("a {,1} b ."), set("b", "ab"), "ab", 3);
        for (String postfix : Arrays.asList("a {}", "a {x}", "a {3,1}")) {
            try {
                compiler.compilePostfix(postfix);
                fail(postfix);
            } catch (PatternSyntaxException e) {
                assertEquals(postfix, 2, e.getIndex());
            }
        }
    }

    public void testCountedClosureLimit() {
        assertSyntaxError("a{200000}", 1);
        assertSyntaxError("(ab){2,100000}", 4);
        assertRegex("a{3}", "a", 4, "aaa");
    }

    public void testSyntaxErrors() {
        assertSyntaxError("a|", 1);
        assertSyntaxError("*a", 0);
        assertSyntaxError("a||b", 1);
        assertSyntaxError("(a", 0);
        assertSyntaxError("a)", 1);
        assertSyntaxError("[ab", 0);
        assertSyntaxError("a{3,1}", 1);
        assertSyntaxError("a{x}", 1);
        assertSyntaxError("a{2", 1);
        assertSyntaxError("\\A", 0);
        assertSyntaxError("ab\\", 2);
        assertSyntaxError("[z-a]", 3);
        assertSyntaxError("a" + Nfa.EPSILON, 1);
    }

    public void testAst() {
        Ast ast = compiler.parseAst("a|bc*");
        assertEquals("(a|(b.(c)*))", ast.toExpression());
        assertEquals(Operators.UNION, ast.op(ast.root()));
        assertEquals(-1, compiler.parseAst("").root());
        assertEquals("", compiler.parseAst("").toExpression());
    }

    public void testLabelsAndDeterminizer() {
        AssocPropertyMap<Character, String> labels = AssocPropertyMap.required();
        labels.put('\t', "TAB");
        RegexCompiler labeled = new RegexCompiler(RegexCompiler.PRINTABLE, labels,
            new Determinizer(1000, true));
        Automaton dfa = labeled.compileDfa("\\ta");
        assertTrue(dfa.isComplete());
        assertTrue(dfa.toString(labeled.labels()), dfa.toString(labeled.labels()).contains("TAB"));
        assertTrue(dfa.accepts("\ta"));
    }
}
