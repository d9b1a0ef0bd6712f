package com.example.photostatus.client.dedupe;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Bounded set of recently seen event ids with strict first-in first-out eviction.
 * Not thread-safe; owned by the stream connector's scheduler.
 */
public class EventDedupeCache {

    public static final int DEFAULT_CAPACITY = 200;

    private final int capacity;
    private final Set<String> ids = new LinkedHashSet<>();

    public EventDedupeCache() {
        this(DEFAULT_CAPACITY);
    }

    public EventDedupeCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public boolean has(String id) {
        return id != null && ids.contains(id);
    }

    /**
     * Remembers the id, evicting the oldest once over capacity. Blank ids and ids already
     * present are ignored, so re-adding does not refresh an id's position.
     */
    public void add(String id) {
        if (id == null || id.isBlank() || ids.contains(id)) {
            return;
        }
        ids.add(id);
        Iterator<String> oldest = ids.iterator();
        while (ids.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }

    public int size() {
        return ids.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
