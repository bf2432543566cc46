package org.carball.queryopt.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only log holding at most {@code capacity} entries; the oldest entry is dropped first.
 * All operations are atomic with respect to each other.
 */
public class BoundedLog<T> {

    private final Deque<T> entries = new ArrayDeque<>();
    private final int capacity;

    public BoundedLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Appends an entry and returns the number of entries dropped to stay within capacity.
     */
    public synchronized int append(T entry) {
        entries.addLast(entry);
        int dropped = 0;
        while (entries.size() > capacity) {
            entries.removeFirst();
            dropped++;
        }
        return dropped;
    }

    public synchronized int removeIf(Predicate<? super T> filter) {
        int before = entries.size();
        entries.removeIf(filter);
        return before - entries.size();
    }

    /**
     * Replaces the contents, keeping only the newest {@code capacity} entries.
     */
    public synchronized void replaceWith(Collection<? extends T> newEntries) {
        entries.clear();
        newEntries.forEach(this::append);
    }

    public synchronized List<T> snapshot() {
        return new ArrayList<>(entries);
    }

    /**
     * Returns up to {@code limit} of the newest entries, newest first.
     */
    public synchronized List<T> newest(int limit) {
        List<T> result = new ArrayList<>(Math.min(limit, entries.size()));
        var iterator = entries.descendingIterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        return result;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }

    public int getCapacity() {
        return capacity;
    }
}
