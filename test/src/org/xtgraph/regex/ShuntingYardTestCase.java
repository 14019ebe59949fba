/* @LICENSE@
 */

package org.xtgraph.regex;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import junit.framework.TestCase;

public class ShuntingYardTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ShuntingYardTestCase.class);
    }

    public ShuntingYardTestCase(String name) {
        super(name);
    }

    private final RegexCompiler compiler = new RegexCompiler();

    private static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            if (sb.length() > 0) sb.append(' ');
            sb.append(t.text());
        }
        return sb.toString();
    }

    private void assertRegexPostfix(String expected, String regex) {
        assertEquals(regex, expected, join(compiler.postfix(regex)));
    }

    private static void assertAlgebraPostfix(String expected, String expression) {
        assertEquals(expression, expected, join(AlgebraEvaluator.postfix(expression)));
    }

    public void testRegexPrecedence() {
        assertRegexPostfix("a b |", "a|b");
        assertRegexPostfix("a b c * . |", "a|bc*");
        assertRegexPostfix("a b | c .", "(a|b)c");
        assertRegexPostfix("a b . c ? |", "ab|c?");
        assertRegexPostfix("a * ?", "a*?");
        assertRegexPostfix("a {2} b .", "a{2}b");
        assertRegexPostfix("a b | c |", "a|b|c");
    }

    public void testExplicitConcatenation() {
        List<Token> infix = compiler.tokenize("a.b");
        assertEquals(3, infix.size());
        assertRegexPostfix("a b .", "a.b");
        assertRegexPostfix("a b . c .", "a.bc");
    }

    public void testAlgebraPrecedence() {
        assertAlgebraPostfix("1 2 3 * +", "1 + 2 * 3");
        assertAlgebraPostfix("10 4 - 3 -", "10 - 4 - 3");
        assertAlgebraPostfix("2 3 2 ^ ^", "2 ^ 3 ^ 2");
        assertAlgebraPostfix("2 2 ^ -", "-2 ^ 2");
        assertAlgebraPostfix("2 3 - *", "2 * -3");
        assertAlgebraPostfix("2 3 - *", "2 * (-3)");
    }

    public void testUnaryTokens() {
        List<Token> infix = AlgebraTokenizer.tokenize("-a - b");
        assertEquals(Operators.UNARY_MINUS, infix.get(0).op());
        assertEquals(Operators.SUB, infix.get(2).op());
        assertTrue(Operators.UNARY_MINUS.isPrefix());
        assertFalse(Operators.STAR.isPrefix());
    }

    public void testVisitor() {
        final int[] counts = new int[3];
        String regex = "(a|b)";
        ShuntingYard.postfix(regex, compiler.tokenize(regex), new ShuntingYardVisitor() {
            @Override
            public void onPushOperator(Token t) {
                ++counts[0];
            }

            @Override
            public void onPopOperator(Token t) {
                ++counts[1];
            }

            @Override
            public void onPushOutput(Token t) {
                ++counts[2];
            }
        });
        // '(' and '|' in, both out; a, b, '|' to the output
        assertEquals(2, counts[0]);
        assertEquals(2, counts[1]);
        assertEquals(3, counts[2]);
    }

    public void testUnbalanced() {
        try {
            compiler.postfix("(a");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(0, e.getIndex());
        }
        try {
            compiler.postfix("ab)");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(2, e.getIndex());
        }
        try {
            AlgebraEvaluator.postfix("(1 + 2))");
            fail();
        } catch (PatternSyntaxException e) {
            assertEquals(7, e.getIndex());
        }
    }

    public void testParsePostfix() {
        List<Token> tokens = ShuntingYard.parsePostfix("a  bc |", Operators.REGEX);
        assertEquals(3, tokens.size());
        assertTrue(tokens.get(0).isOperand());
        assertEquals(3, tokens.get(1).position());
        assertEquals(Operators.UNION, tokens.get(2).op());
    }
}
