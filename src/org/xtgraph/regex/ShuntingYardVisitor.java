/*
 * @LICENSE@
 */

package org.xtgraph.regex;

/**
 * Hooks into {@link ShuntingYard}; all default to doing nothing.
 */
public abstract class ShuntingYardVisitor {

    public void onPushOperator(Token t) {}

    public void onPopOperator(Token t) {}

    public void onPushOutput(Token t) {}
}
