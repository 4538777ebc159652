package energy.server.cache;

import io.vertx.core.json.JsonObject;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Capacity-bounded cache with least-recently-used eviction and no expiry.
 * A hit refreshes recency; so does a put on an existing key.
 */
public class LruCache<K, V> {

    private final int capacity;
    private final LinkedHashMap<K, V> entries;

    private long hits;
    private long misses;
    private long evictions;

    public LruCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<K, V>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean evict = size() > LruCache.this.capacity;
                if (evict) {
                    evictions++;
                }
                return evict;
            }
        };
    }

    public synchronized V get(K key) {
        V value = entries.get(key);
        if (value == null) {
            misses++;
        } else {
            hits++;
        }
        return value;
    }

    public synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    public synchronized long evictions() {
        return evictions;
    }

    public synchronized int currentSize() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public synchronized JsonObject stats() {
        return new JsonObject()
            .put("hits", hits)
            .put("misses", misses)
            .put("evictions", evictions)
            .put("currentSize", entries.size())
            .put("capacity", capacity);
    }
}
