/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Read access to data attached to the vertices or edges of a graph, without
 * touching the graph structure itself.
 * <p>
 * A <em>required</em> map has no value for keys it was never given and
 * {@link #get(Object)} fails with a {@link KeyNotFoundException}. An
 * <em>optional</em> map answers such keys with its default value (possibly
 * <code>null</code>, the absence marker).
 * <p>
 * Maps are handed to algorithms by reference; algorithms write through them
 * and the caller sees the result. There is one logical writer at a time.
 *
 * @param <K> key type (a vertex handle or an edge)
 * @param <V> value type
 */
public interface PropertyMap<K, V> {

    /**
     * @param key the vertex or edge
     * @return the value attached to <code>key</code>, or the default value of
     *         an optional map
     * @throws KeyNotFoundException if the map is required and has no value
     *             for <code>key</code>
     */
    V get(K key);

    /**
     * @param key the vertex or edge
     * @return whether a value was explicitly attached to <code>key</code>
     */
    boolean has(K key);
}
