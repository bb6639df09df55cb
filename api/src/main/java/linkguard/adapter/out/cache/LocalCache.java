package linkguard.adapter.out.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-instance cache of short code lookups.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface LocalCache<K, V> {

    Optional<V> get(K key);

    /**
     * Store a value for the cache's default lifetime.
     */
    void put(K key, V value);

    /**
     * Store a value for at most {@code ttl}; the default lifetime still caps it.
     * A non-positive TTL removes any cached value instead.
     */
    void put(K key, V value, Duration ttl);

    long estimatedSize();
}
