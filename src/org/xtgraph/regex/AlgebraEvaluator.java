/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Arithmetic over the algebra operator table: numeric evaluation, or a
 * syntax tree.
 */
public final class AlgebraEvaluator {

    private AlgebraEvaluator() {
    }

    public static List<Token> postfix(String expression) {
        return ShuntingYard.postfix(expression, AlgebraTokenizer.tokenize(expression));
    }

    /**
     * @throws PatternSyntaxException on a malformed expression or an operand
     *             that is not a number
     */
    public static double compute(String expression) {
        return new RpnDeque<Double>(expression) {
            @Override
            protected Double operand(Token t) {
                try {
                    return Double.valueOf(t.text());
                } catch (NumberFormatException e) {
                    throw syntaxError("Not a number: " + t.text(), t.position());
                }
            }

            @Override
            protected Double operation(Token t, List<Double> args) {
                Op op = t.op();
                double a = args.get(0);
                if (op == Operators.UNARY_PLUS) return a;
                if (op == Operators.UNARY_MINUS) return -a;
                double b = args.get(1);
                if (op == Operators.POW) return Math.pow(a, b);
                if (op == Operators.MUL) return a * b;
                if (op == Operators.DIV) return a / b;
                if (op == Operators.ADD) return a + b;
                if (op == Operators.SUB) return a - b;
                throw syntaxError("Unsupported operator '" + t.text() + "'", t.position());
            }
        }.evaluate(postfix(expression));
    }

    public static Ast parse(String expression) {
        return new AstBuilder(expression).build(postfix(expression));
    }
}
