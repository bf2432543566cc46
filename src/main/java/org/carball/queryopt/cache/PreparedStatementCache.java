package org.carball.queryopt.cache;

import lombok.extern.slf4j.Slf4j;
import org.carball.queryopt.model.query.PreparedHandle;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded cache of prepared-statement handles with least-recently-used eviction.
 * Backed by an access-ordered {@link LinkedHashMap}, so touching and evicting are O(1).
 */
@Slf4j
public class PreparedStatementCache {

    private final Map<String, PreparedHandle> handles = new LinkedHashMap<>(16, 0.75f, true);
    private final int capacity;

    public PreparedStatementCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Prepared statement cache capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Returns the handle for the given identity, touching it, or creates one.
     * When the cache is full the least recently used handle is evicted before inserting.
     */
    public synchronized PreparedHandle getOrCreate(String queryId, String sql, Instant now) {
        PreparedHandle existing = handles.get(queryId);
        if (existing != null) {
            existing.touch(now);
            return existing;
        }

        if (handles.size() >= capacity) {
            evictLeastRecentlyUsed();
        }

        PreparedHandle handle = new PreparedHandle(queryId, sql, now);
        handles.put(queryId, handle);
        log.debug("Created prepared statement handle for query {} ({} cached)", queryId, handles.size());
        return handle;
    }

    /**
     * Removes handles not used since the cutoff and returns how many were removed.
     */
    public synchronized int removeUnusedSince(Instant cutoff) {
        int removed = 0;
        Iterator<PreparedHandle> iterator = handles.values().iterator();
        while (iterator.hasNext()) {
            PreparedHandle handle = iterator.next();
            if (handle.getLastUsed() == null || handle.getLastUsed().isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        return removed;
    }

    /**
     * Replaces the contents with copies of the given handles, least recently used first.
     */
    public synchronized void restore(Collection<PreparedHandle> restored) {
        handles.clear();
        restored.stream()
                .filter(h -> h.getQueryId() != null)
                .sorted((a, b) -> compareLastUsed(a.getLastUsed(), b.getLastUsed()))
                .forEach(h -> {
                    if (handles.size() >= capacity) {
                        evictLeastRecentlyUsed();
                    }
                    handles.put(h.getQueryId(), h.copy());
                });
    }

    public synchronized List<PreparedHandle> snapshot() {
        List<PreparedHandle> copies = new ArrayList<>(handles.size());
        handles.values().forEach(h -> copies.add(h.copy()));
        return copies;
    }

    public synchronized boolean contains(String queryId) {
        return handles.containsKey(queryId);
    }

    public synchronized int size() {
        return handles.size();
    }

    public synchronized void clear() {
        handles.clear();
    }

    public int getCapacity() {
        return capacity;
    }

    private void evictLeastRecentlyUsed() {
        Iterator<Map.Entry<String, PreparedHandle>> eldest = handles.entrySet().iterator();
        if (eldest.hasNext()) {
            String evicted = eldest.next().getKey();
            eldest.remove();
            log.debug("Evicted least recently used prepared statement {}", evicted);
        }
    }

    private static int compareLastUsed(Instant a, Instant b) {
        if (a == null) {
            return b == null ? 0 : -1;
        }
        return b == null ? 1 : a.compareTo(b);
    }
}
