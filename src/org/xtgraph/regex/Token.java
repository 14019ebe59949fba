/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.Collections;
import java.util.SortedSet;

/**
 * Lexical unit of an infix or postfix expression. Regex operands carry the
 * set of symbols they match.
 */
public final class Token {

    public enum Kind {
        OPERAND, OPERATOR, LEFT_PAREN, RIGHT_PAREN
    }

    private final Kind kind;
    private final String text;
    private final int position;
    private final Op op;
    private final SortedSet<Character> symbols;
    private final boolean epsilon;

    private Token(Kind kind, String text, int position, Op op, SortedSet<Character> symbols,
                  boolean epsilon) {
        this.kind = kind;
        this.text = text;
        this.position = position;
        this.op = op;
        this.symbols = symbols;
        this.epsilon = epsilon;
    }

    private Token(Kind kind, String text, int position, Op op, SortedSet<Character> symbols) {
        this(kind, text, position, op, symbols, false);
    }

    public static Token operand(String text, int position) {
        return new Token(Kind.OPERAND, text, position, null, null);
    }

    public static Token operand(String text, int position, SortedSet<Character> symbols) {
        return new Token(Kind.OPERAND, text, position, null,
            Collections.unmodifiableSortedSet(symbols));
    }

    /**
     * Operand matching only the empty word, as an empty group <code>()</code>.
     */
    public static Token epsilon(int position) {
        return new Token(Kind.OPERAND, "()", position, null, null, true);
    }

    public static Token operator(String text, int position, Op op) {
        return new Token(Kind.OPERATOR, text, position, op, null);
    }

    public static Token leftParen(int position) {
        return new Token(Kind.LEFT_PAREN, "(", position, null, null);
    }

    public static Token rightParen(int position) {
        return new Token(Kind.RIGHT_PAREN, ")", position, null, null);
    }

    public Kind kind() {
        return kind;
    }

    public String text() {
        return text;
    }

    /**
     * @return index in the source expression, -1 if synthesized
     */
    public int position() {
        return position;
    }

    /**
     * @return the operator, <code>null</code> unless this is an operator
     */
    public Op op() {
        return op;
    }

    /**
     * @return the symbols a regex operand matches, <code>null</code> otherwise
     */
    public SortedSet<Character> symbols() {
        return symbols;
    }

    public boolean isOperand() {
        return kind == Kind.OPERAND;
    }

    public boolean isEpsilon() {
        return epsilon;
    }

    public boolean isOperator() {
        return kind == Kind.OPERATOR;
    }

    @Override
    public String toString() {
        return text;
    }
}
