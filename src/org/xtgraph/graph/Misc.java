/*
 * @LICENSE@
 */

package org.xtgraph.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
public final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * So many iterators don't suport remove()
     */
    public static abstract class ImmutableIterator<E> implements Iterator<E> {
        public final void remove() {
            throw new UnsupportedOperationException("sorry!");
        }
    }

    /**
     * Counts the elements of an iterable without keeping them.
     */
    public static int count(Iterable<?> it) {
        if (it instanceof Collection<?>) return ((Collection<?>) it).size();
        int n = 0;
        for (Iterator<?> i = it.iterator(); i.hasNext(); i.next()) ++n;
        return n;
    }

    /*
     * Filter iterator stuff
     */
    public interface Filter<T> {
        boolean filter(T t);
    }

    private static final Filter<Object> passAll = new Filter<Object>() {
        public boolean filter(Object o) {
            return true;
        }
    };

    @SuppressWarnings("unchecked")
    public static <T> Filter<T> passAll() {
        return (Filter<T>) passAll;
    }

    public static <T> Filter<T> and(final Filter<? super T> lhs, final Filter<? super T> rhs) {
        return new Filter<T>() {
            public boolean filter(T t) {
                return lhs.filter(t) && rhs.filter(t);
            }
        };
    }

    public static <T> Filter<T> or(final Filter<? super T> lhs, final Filter<? super T> rhs) {
        return new Filter<T>() {
            public boolean filter(T t) {
                return lhs.filter(t) || rhs.filter(t);
            }
        };
    }

    /**
     * Lazily filters an iterable; each call to <code>iterator()</code>
     * restarts from the source.
     */
    public static final class FilterIterable<T> implements Iterable<T> {
        private final Iterable<T> source;
        private final Filter<? super T> filter;

        public FilterIterable(Iterable<T> source, Filter<? super T> filter) {
            this.source = source;
            this.filter = filter;
        }

        public Iterator<T> iterator() {
            return new FilterIterator<T>(source.iterator(), filter);
        }
    }

    /*
     * N.B. "fast fail" is one element slower...
     */
    private static final class FilterIterator<T> extends ImmutableIterator<T> {
        private final Iterator<T> iter;
        private final Filter<? super T> filter;
        private T t;

        FilterIterator(Iterator<T> iter, Filter<? super T> filter) {
            this.iter = iter;
            this.filter = filter;
            this.t = nextT();
        }

        public boolean hasNext() {
            return t != null;
        }

        public T next() {
            T ret = t;
            t = nextT();
            return ret;
        }

        private T nextT() {
            while (iter.hasNext()) {
                T t = iter.next();
                if (filter.filter(t))
                    return t;
            }
            return null;
        }
    }

    /**
     * Copies an iterable into a fresh list; handy before mutating the
     * structure the iterable reads from.
     */
    public static <T> List<T> listFrom(Iterable<? extends T> it) {
        List<T> ret = new ArrayList<T>();
        for (T t : it) ret.add(t);
        return ret;
    }
}
