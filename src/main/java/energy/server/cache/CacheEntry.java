package energy.server.cache;

/**
 * A cached value with the time it was inserted.
 */
public class CacheEntry<K, V> {

    private final K key;
    private final V value;
    private final long insertedAtMillis;

    public CacheEntry(K key, V value, long insertedAtMillis) {
        this.key = key;
        this.value = value;
        this.insertedAtMillis = insertedAtMillis;
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public long getInsertedAtMillis() {
        return insertedAtMillis;
    }

    public boolean isExpired(long nowMillis, long ttlMillis) {
        return nowMillis - insertedAtMillis >= ttlMillis;
    }
}
