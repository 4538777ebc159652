package energy.server.cache;

import io.vertx.core.json.JsonObject;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.function.LongSupplier;

/**
 * Cache whose entries expire a fixed time after insertion.
 *
 * An expired entry counts as a miss and is removed by the read that finds it.
 * At capacity the oldest insertion is dropped. All operations are serialized
 * on the instance monitor.
 */
public class TimeBoundedCache<K, V> {

    private final int capacity;
    private final long ttlMillis;
    private final LongSupplier clock;
    private final LinkedHashMap<K, CacheEntry<K, V>> entries = new LinkedHashMap<>();

    private long hits;
    private long misses;

    public TimeBoundedCache(int capacity, Duration ttl) {
        this(capacity, ttl, System::currentTimeMillis);
    }

    public TimeBoundedCache(int capacity, Duration ttl, LongSupplier clock) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        this.capacity = capacity;
        this.ttlMillis = ttl.toMillis();
        this.clock = clock;
    }

    public synchronized V get(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return null;
        }
        if (entry.isExpired(clock.getAsLong(), ttlMillis)) {
            entries.remove(key);
            misses++;
            return null;
        }
        hits++;
        return entry.getValue();
    }

    public synchronized void put(K key, V value) {
        entries.remove(key);
        if (entries.size() >= capacity) {
            Iterator<K> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        entries.put(key, new CacheEntry<>(key, value, clock.getAsLong()));
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

    /**
     * Number of stored entries, expired ones not yet read included.
     */
    public synchronized int currentSize() {
        return entries.size();
    }

    public synchronized JsonObject stats() {
        return new JsonObject()
            .put("hits", hits)
            .put("misses", misses)
            .put("currentSize", entries.size())
            .put("capacity", capacity)
            .put("ttlSeconds", ttlMillis / 1000);
    }
}
