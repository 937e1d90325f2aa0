package io.kvlink.storage;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Equality index of one field: index value to the ids carrying it.
 */
public final class HashIndex {
    private final ConcurrentHashMap<String, Set<Long>> index = new ConcurrentHashMap<>();

    public void add(String key, long id) {
        if (key == null) {
            throw new IllegalArgumentException("key required");
        }
        index.compute(key, (ignored, existing) -> {
            Set<Long> ids = existing == null ? ConcurrentHashMap.newKeySet() : existing;
            ids.add(id);
            return ids;
        });
    }

    public void remove(String key, long id) {
        if (key == null) {
            return;
        }
        index.computeIfPresent(key, (ignored, existing) -> {
            existing.remove(id);
            return existing.isEmpty() ? null : existing;
        });
    }

    /**
     * Snapshot of the ids stored under a key, in ascending order.
     */
    public Set<Long> lookup(String key) {
        if (key == null) {
            return Collections.emptySet();
        }
        Set<Long> ids = index.get(key);
        return ids == null ? Collections.emptySet() : Collections.unmodifiableSet(new TreeSet<>(ids));
    }

    /**
     * Copy of the entries, safe to iterate while the index changes.
     */
    public Map<String, Set<Long>> entries() {
        var copy = new HashMap<String, Set<Long>>();
        index.forEach((key, ids) -> copy.put(key, Set.copyOf(ids)));
        return copy;
    }
}
