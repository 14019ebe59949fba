/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Array backed {@link ReadWritePropertyMap} keyed by vertex handles. Suited to
 * the dense <code>0..n-1</code> handle range the graphs of this package hand
 * out; the backing list grows on demand.
 *
 * @param <V> value type
 */
public final class ArrayPropertyMap<V> implements ReadWritePropertyMap<Integer, V> {

    private static final Object UNSET = new Object();

    private final List<Object> values = new ArrayList<Object>();
    private final boolean required;
    private final V defaultValue;

    private ArrayPropertyMap(boolean required, V defaultValue) {
        this.required = required;
        this.defaultValue = defaultValue;
    }

    public static <V> ArrayPropertyMap<V> required() {
        return new ArrayPropertyMap<V>(true, null);
    }

    public static <V> ArrayPropertyMap<V> withDefault(V defaultValue) {
        return new ArrayPropertyMap<V>(false, defaultValue);
    }

    @SuppressWarnings("unchecked")
    public V get(Integer key) {
        int i = index(key);
        Object o = i < values.size() ? values.get(i) : UNSET;
        if (o == UNSET) {
            if (required) throw new KeyNotFoundException(key);
            return defaultValue;
        }
        return (V) o;
    }

    public boolean has(Integer key) {
        int i = index(key);
        return i < values.size() && values.get(i) != UNSET;
    }

    public void put(Integer key, V value) {
        int i = index(key);
        while (values.size() <= i) values.add(UNSET);
        values.set(i, value);
    }

    private static int index(Integer key) {
        if (key == null || key < 0) {
            throw new IllegalArgumentException("not a vertex handle: " + key);
        }
        return key;
    }
}
