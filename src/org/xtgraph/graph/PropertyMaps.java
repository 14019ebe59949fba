/*
 * @LICENSE@
 */

package org.xtgraph.graph;

/**
 * Static factories for the read-only {@link PropertyMap} flavors.
 */
public final class PropertyMaps {

    private PropertyMaps() {
    } // never instantiated

    /**
     * Computes a value from a key. Pre-lambda style callback, implemented with
     * anonymous classes.
     */
    public interface Function<K, V> {
        V apply(K key);
    }

    /**
     * @return a map answering every key with <code>value</code>
     */
    public static <K, V> PropertyMap<K, V> constant(final V value) {
        return new PropertyMap<K, V>() {
            public V get(K key) {
                return value;
            }
            public boolean has(K key) {
                return true;
            }
        };
    }

    /**
     * @return a map answering every key with itself
     */
    public static <K> PropertyMap<K, K> identity() {
        return new PropertyMap<K, K>() {
            public K get(K key) {
                return key;
            }
            public boolean has(K key) {
                return true;
            }
        };
    }

    /**
     * @return a map computing its values with <code>f</code>
     */
    public static <K, V> PropertyMap<K, V> of(final Function<? super K, ? extends V> f) {
        return new PropertyMap<K, V>() {
            public V get(K key) {
                return f.apply(key);
            }
            public boolean has(K key) {
                return true;
            }
        };
    }
}
