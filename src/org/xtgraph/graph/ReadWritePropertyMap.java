/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * A {@link PropertyMap} which can also be written.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface ReadWritePropertyMap<K, V> extends PropertyMap<K, V> {

    /**
     * Attaches <code>value</code> to <code>key</code>, overwriting any
     * previous value.
     */
    void put(K key, V value);
}
