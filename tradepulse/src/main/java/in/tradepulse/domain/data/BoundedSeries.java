package in.tradepulse.domain.data;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Most recent N elements in insertion order.
 *
 * Appending beyond capacity evicts the oldest element. Snapshots are
 * immutable copies, so indicator code can never mutate the live series.
 * Not thread-safe: owned by the single stream-processing thread.
 */
public final class BoundedSeries<T> {

    private final int capacity;
    private final Deque<T> items;

    public BoundedSeries(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Append an element, evicting the oldest when full.
     *
     * @return the evicted element, or null if nothing was evicted
     */
    public T add(T item) {
        if (item == null) {
            throw new IllegalArgumentException("Series does not accept null");
        }
        T evicted = null;
        if (items.size() == capacity) {
            evicted = items.pollFirst();
        }
        items.addLast(item);
        return evicted;
    }

    public int size() {
        return items.size();
    }

    public T last() {
        return items.peekLast();
    }

    /**
     * Immutable snapshot, oldest first.
     */
    public List<T> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }
}
