/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.PatternSyntaxException;

/**
 * Dijkstra's shunting-yard: infix tokens to postfix, honoring each
 * operator's precedence and associativity. Parentheses do not appear in the
 * output.
 */
public final class ShuntingYard {

    private static final ShuntingYardVisitor NOP = new ShuntingYardVisitor() {};

    private ShuntingYard() {
    }

    public static List<Token> postfix(String expression, List<Token> infix) {
        return postfix(expression, infix, NOP);
    }

    /**
     * @param expression source text, for error reports only
     * @throws PatternSyntaxException on unbalanced parentheses, with the
     *             index of the offending one
     */
    public static List<Token> postfix(String expression, List<Token> infix, ShuntingYardVisitor vis) {
        List<Token> output = new ArrayList<Token>();
        LinkedList<Token> stack = new LinkedList<Token>();
        for (Token t : infix) {
            switch (t.kind()) {
            case OPERAND:
                output(t, output, vis);
                break;
            case OPERATOR:
                while (!stack.isEmpty()
                       && stack.getFirst().isOperator()
                       && stack.getFirst().op().precedes(t.op())) {
                    output(pop(stack, vis), output, vis);
                }
                stack.addFirst(t);
                vis.onPushOperator(t);
                break;
            case LEFT_PAREN:
                stack.addFirst(t);
                vis.onPushOperator(t);
                break;
            case RIGHT_PAREN:
                for (;;) {
                    if (stack.isEmpty())
                        throw new PatternSyntaxException("Unmatched closing ')'", expression, t.position());
                    Token top = pop(stack, vis);
                    if (top.kind() == Token.Kind.LEFT_PAREN) break;
                    output(top, output, vis);
                }
                break;
            default:
                throw new AssertionError(t.kind());
            }
        }
        while (!stack.isEmpty()) {
            Token top = pop(stack, vis);
            if (top.kind() == Token.Kind.LEFT_PAREN)
                throw new PatternSyntaxException("Unclosed group", expression, top.position());
            output(top, output, vis);
        }
        return output;
    }

    private static Token pop(LinkedList<Token> stack, ShuntingYardVisitor vis) {
        Token t = stack.removeFirst();
        vis.onPopOperator(t);
        return t;
    }

    private static void output(Token t, List<Token> output, ShuntingYardVisitor vis) {
        output.add(t);
        vis.onPushOutput(t);
    }

    /**
     * Splits a whitespace-separated postfix string (<code>"a b |"</code>):
     * words found in <code>table</code> are operators, anything else is an
     * operand.
     */
    public static List<Token> parsePostfix(String postfix, Map<String, Op> table) {
        List<Token> ret = new ArrayList<Token>();
        int i = 0;
        for (String word : postfix.trim().split("\\s+")) {
            if (word.length() == 0) continue;
            i = postfix.indexOf(word, i);
            Op op = table.get(word);
            if (op != null) {
                ret.add(Token.operator(word, i, op));
            } else {
                SortedSet<Character> symbols = new TreeSet<Character>();
                if (word.length() == 1) symbols.add(word.charAt(0));
                ret.add(word.length() == 1
                        ? Token.operand(word, i, symbols)
                        : Token.operand(word, i));
            }
            i += word.length();
        }
        return ret;
    }
}
