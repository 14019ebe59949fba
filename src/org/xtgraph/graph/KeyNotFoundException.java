/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.NoSuchElementException;

/**
 * Thrown when a required {@link PropertyMap} is queried for a key it holds no
 * value for.
 */
public final class KeyNotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    private final Object key;

    public KeyNotFoundException(Object key) {
        super("no value for key: " + key);
        this.key = key;
    }

    /**
     * @return the key which missed
     */
    public Object key() {
        return key;
    }
}
