/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.xtgraph.regex.Op.Associativity;

/**
 * The two operator tables: regular expressions, and arithmetic ("algebra").
 */
public final class Operators {

    private Operators() {
    }

    public static final Op STAR = new Op("*", 1, 4, Associativity.LEFT);
    public static final Op PLUS = new Op("+", 1, 4, Associativity.LEFT);
    /** bounded repetition <code>{m,n}</code>; the bounds travel in the token text */
    public static final Op REPEAT = new Op("{}", 1, 4, Associativity.LEFT);
    public static final Op OPTIONAL = new Op("?", 1, 3, Associativity.LEFT);
    public static final Op CONCAT = new Op(".", 2, 2, Associativity.LEFT);
    public static final Op UNION = new Op("|", 2, 1, Associativity.LEFT);

    public static final Map<String, Op> REGEX = table(STAR, PLUS, REPEAT, OPTIONAL, CONCAT, UNION);

    public static final Op UNARY_PLUS = new Op("u+", 1, 3, Associativity.RIGHT);
    public static final Op UNARY_MINUS = new Op("u-", 1, 3, Associativity.RIGHT);
    public static final Op POW = new Op("^", 2, 4, Associativity.RIGHT);
    public static final Op MUL = new Op("*", 2, 3, Associativity.LEFT);
    public static final Op DIV = new Op("/", 2, 3, Associativity.LEFT);
    public static final Op ADD = new Op("+", 2, 2, Associativity.LEFT);
    public static final Op SUB = new Op("-", 2, 2, Associativity.LEFT);

    public static final Map<String, Op> ALGEBRA =
        table(UNARY_PLUS, UNARY_MINUS, POW, MUL, DIV, ADD, SUB);

    private static Map<String, Op> table(Op... ops) {
        Map<String, Op> ret = new LinkedHashMap<String, Op>();
        for (Op op : ops) ret.put(op.name(), op);
        return Collections.unmodifiableMap(ret);
    }
}
