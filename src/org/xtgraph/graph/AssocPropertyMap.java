/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.HashMap;
import java.util.Map;

/**
 * Associative {@link ReadWritePropertyMap} for sparse key spaces, e.g. edges
 * or vertex sets.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class AssocPropertyMap<K, V> implements ReadWritePropertyMap<K, V> {

    private final Map<K, V> map;
    private final boolean required;
    private final V defaultValue;

    private AssocPropertyMap(Map<K, V> map, boolean required, V defaultValue) {
        assert map != null;
        this.map = map;
        this.required = required;
        this.defaultValue = defaultValue;
    }

    /**
     * @return a map failing on unknown keys
     */
    public static <K, V> AssocPropertyMap<K, V> required() {
        return new AssocPropertyMap<K, V>(new HashMap<K, V>(), true, null);
    }

    /**
     * @return a map answering unknown keys with <code>defaultValue</code>
     */
    public static <K, V> AssocPropertyMap<K, V> withDefault(V defaultValue) {
        return new AssocPropertyMap<K, V>(new HashMap<K, V>(), false, defaultValue);
    }

    /**
     * Wraps an existing map; writes go through to it.
     */
    public static <K, V> AssocPropertyMap<K, V> wrap(Map<K, V> map, V defaultValue) {
        return new AssocPropertyMap<K, V>(map, false, defaultValue);
    }

    public V get(K key) {
        V v = map.get(key);
        if (v == null && !map.containsKey(key)) {
            if (required) throw new KeyNotFoundException(key);
            return defaultValue;
        }
        return v;
    }

    public boolean has(K key) {
        return map.containsKey(key);
    }

    public void put(K key, V value) {
        map.put(key, value);
    }

    int size() {
        return map.size();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
