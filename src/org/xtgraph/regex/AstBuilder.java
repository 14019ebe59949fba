/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.List;

/**
 * Postfix evaluation building an {@link Ast}: the parsing algebra.
 */
public class AstBuilder extends RpnDeque<Integer> {

    private final Ast ast = new Ast();

    public AstBuilder(String expression) {
        super(expression);
    }

    /**
     * An empty postfix stream yields an empty tree.
     */
    public Ast build(List<Token> postfix) {
        if (!postfix.isEmpty()) ast.setRoot(evaluate(postfix));
        return ast;
    }

    @Override
    protected Integer operand(Token t) {
        return ast.addLeaf(t.text());
    }

    @Override
    protected Integer operation(Token t, List<Integer> args) {
        return ast.addNode(t.text(), t.op(), args);
    }
}
