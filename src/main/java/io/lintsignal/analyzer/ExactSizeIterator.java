package io.lintsignal.analyzer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Finite iterator that knows how many elements it has left.
 * Single pass: once an element is returned it cannot be obtained again from this iterator.
 *
 * @param <T> element type
 */
public abstract class ExactSizeIterator<T> implements Iterator<T> {

    /**
     * Number of elements not yet returned.
     */
    public abstract int remaining();

    @Override
    public boolean hasNext() {
        return remaining() > 0;
    }

    /**
     * Consumes the remaining elements into a list.
     */
    public List<T> drain() {
        List<T> result = new ArrayList<>(remaining());
        while (hasNext()) {
            result.add(next());
        }
        return result;
    }
}
