/*
 * @LICENSE@
 */

/**
 * Infix expressions to postfix to something else. {@link
 * org.xtgraph.regex.ShuntingYard} converts tokens from either operator table
 * of {@link org.xtgraph.regex.Operators}; {@link org.xtgraph.regex.RpnDeque}
 * subclasses evaluate the postfix stream into an NFA (Thompson
 * construction, through {@link org.xtgraph.regex.RegexCompiler}), an
 * {@link org.xtgraph.regex.Ast}, or a number ({@link
 * org.xtgraph.regex.AlgebraEvaluator}).
 * <p>
 * Malformed input is reported with {@link
 * java.util.regex.PatternSyntaxException}.
 */
package org.xtgraph.regex;
