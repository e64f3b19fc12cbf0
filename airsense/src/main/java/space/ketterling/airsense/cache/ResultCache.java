package space.ketterling.airsense.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory key/value store with a per-entry time-to-live.
 *
 * <p>
 * Expiry is enforced on read: {@link #get(Object)} never returns an entry whose expiry
 * has passed, whether or not {@link #evictExpired()} has run. The periodic sweep only
 * keeps memory from holding entries nobody asks for again. There is no size bound.
 * </p>
 */
public final class ResultCache<K, V> {
    private static final Logger log = LoggerFactory.getLogger(ResultCache.class);

    private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Duration defaultTtl;
    private final Clock clock;

    /**
     * Creates a cache whose {@link #set(Object, Object)} uses {@code defaultTtl}.
     */
    public ResultCache(Duration defaultTtl, Clock clock) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero())
            throw new IllegalArgumentException("default ttl must be positive");
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores a value with the default time-to-live, replacing any previous entry.
     */
    public void set(K key, V value) {
        set(key, value, defaultTtl);
    }

    /**
     * Stores a value that stays visible for {@code ttl} from now.
     */
    public void set(K key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Duration effective = ttl == null ? defaultTtl : ttl;
        entries.put(key, new CacheEntry<>(value, clock.instant().plus(effective)));
    }

    /**
     * Returns the value if present and not expired. An expired entry is removed.
     */
    public Optional<V> get(K key) {
        CacheEntry<V> entry = entries.get(key);
        if (entry == null)
            return Optional.empty();

        if (entry.isExpired(clock.instant())) {
            // conditional remove: a fresh value written concurrently must survive
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void delete(K key) {
        entries.remove(key);
    }

    public void clear() {
        entries.clear();
    }

    /**
     * Removes every entry whose expiry has passed and returns how many were dropped.
     */
    public int evictExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<K, CacheEntry<V>> e : entries.entrySet()) {
            if (e.getValue().isExpired(now) && entries.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        if (removed > 0)
            log.debug("Evicted {} expired cache entries ({} remain)", removed, entries.size());
        return removed;
    }

    /**
     * Number of stored entries, including expired ones not yet evicted.
     */
    public int size() {
        return entries.size();
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    private record CacheEntry<V>(V value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
