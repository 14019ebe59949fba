/*
 * @LICENSE@
 */

package org.xtgraph.regex;

import java.util.ArrayList;
import java.util.List;

import org.xtgraph.graph.ArrayPropertyMap;
import org.xtgraph.graph.DirectedGraph;
import org.xtgraph.graph.Edge;
import org.xtgraph.graph.PropertyMap;

/**
 * Syntax tree of an expression, as a directed graph from each operator node
 * to its arguments (left to right) plus a symbol property map.
 */
public class Ast extends DirectedGraph {

    private final ArrayPropertyMap<String> symbols = ArrayPropertyMap.required();
    private final ArrayPropertyMap<Op> ops = ArrayPropertyMap.withDefault(null);
    private int root = -1;

    public int addLeaf(String symbol) {
        int u = addVertex();
        symbols.put(u, symbol);
        return u;
    }

    public int addNode(String symbol, Op op, List<Integer> children) {
        if (children.size() != op.arity())
            throw new IllegalArgumentException(op + " takes " + op.arity() + " arguments");
        int u = addLeaf(symbol);
        ops.put(u, op);
        for (int v : children) addEdge(u, v);
        return u;
    }

    public PropertyMap<Integer, String> symbols() {
        return symbols;
    }

    /**
     * @return the operator of node <code>u</code>, <code>null</code> for a leaf
     */
    public Op op(int u) {
        return ops.get(u);
    }

    /**
     * @return the root node, -1 for an empty tree
     */
    public int root() {
        return root;
    }

    public void setRoot(int u) {
        if (!containsVertex(u)) throw new IllegalArgumentException("no such node: " + u);
        root = u;
    }

    public List<Integer> children(int u) {
        List<Integer> ret = new ArrayList<Integer>();
        for (Edge e : outEdges(u)) ret.add(e.target());
        return ret;
    }

    public String toExpression() {
        return root == -1 ? "" : toExpression(root);
    }

    /**
     * Fully parenthesized infix form of the subtree at <code>u</code>.
     */
    public String toExpression(int u) {
        String symbol = symbols.get(u);
        Op op = ops.get(u);
        if (op == null) return symbol;
        List<Integer> children = children(u);
        if (op.arity() == 1) {
            String arg = "(" + toExpression(children.get(0)) + ")";
            return op.isPrefix() ? symbol + arg : arg + symbol;
        }
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); ++i) {
            if (i > 0) sb.append(symbol);
            sb.append(toExpression(children.get(i)));
        }
        return sb.append(")").toString();
    }
}
