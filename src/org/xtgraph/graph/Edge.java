/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Edge of a {@link DirectedGraph} or an {@link UndirectedGraph}: an ordered
 * (source, target) pair plus a distinguisher telling parallel edges apart.
 */
public final class Edge implements Comparable<Edge> {

    final int source;
    final int target;
    final int distinguisher;

    Edge(int source, int target, int distinguisher) {
        this.source = source;
        this.target = target;
        this.distinguisher = distinguisher;
    }

    public int source() {
        return source;
    }

    public int target() {
        return target;
    }

    public int distinguisher() {
        return distinguisher;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + source;
        result = prime * result + target;
        result = prime * result + distinguisher;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Edge))
            return false;
        final Edge other = (Edge) obj;
        return source == other.source
            && target == other.target
            && distinguisher == other.distinguisher;
    }

    public int compareTo(Edge e) {
        if (source != e.source) return source < e.source ? -1 : 1;
        if (target != e.target) return target < e.target ? -1 : 1;
        if (distinguisher != e.distinguisher) return distinguisher < e.distinguisher ? -1 : 1;
        return 0;
    }

    @Override
    public String toString() {
        return "(" + source + " -> " + target + ")";
    }
}
