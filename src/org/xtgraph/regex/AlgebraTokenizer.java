/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Splits an arithmetic expression into infix tokens. Operands are numbers or
 * identifiers; <code>+</code> and <code>-</code> are unary at the start, after
 * an operator, or after an opening parenthesis.
 */
public final class AlgebraTokenizer {

    private AlgebraTokenizer() {
    }

    public static List<Token> tokenize(String expression) {
        List<Token> ret = new ArrayList<Token>();
        int n = expression.length();
        for (int i = 0; i < n;) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                ++i;
                continue;
            }
            Token prev = ret.isEmpty() ? null : ret.get(ret.size() - 1);
            switch (c) {
            case '(':
                ret.add(Token.leftParen(i++));
                break;
            case ')':
                ret.add(Token.rightParen(i++));
                break;
            case '+':
            case '-':
                boolean unary = prev == null
                    || prev.isOperator()
                    || prev.kind() == Token.Kind.LEFT_PAREN;
                String key = unary ? "u" + c : String.valueOf(c);
                ret.add(Token.operator(String.valueOf(c), i++, Operators.ALGEBRA.get(key)));
                break;
            case '*':
            case '/':
            case '^':
                ret.add(Token.operator(String.valueOf(c), i++, Operators.ALGEBRA.get(String.valueOf(c))));
                break;
            default:
                if (!isOperandChar(c))
                    throw new PatternSyntaxException("Unexpected character", expression, i);
                int start = i;
                while (i < n && isOperandChar(expression.charAt(i))) ++i;
                ret.add(Token.operand(expression.substring(start, i), start));
                break;
            }
        }
        return ret;
    }

    private static boolean isOperandChar(char c) {
        return Character.isLetterOrDigit(c) || c == '.' || c == '_';
    }
}
