package dev.buyergroup.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import dev.buyergroup.config.ProviderConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Thread-safe provider response cache with time-based expiration.
 * Time comes from the injected {@link Clock}, so expiry can be driven from tests.
 * Shared by every run in the process.
 */
@Component
public class ResponseCache {

    private final Cache<String, Object> cache;

    @Autowired
    public ResponseCache(ProviderConfig config, Clock clock) {
        this(config.getCacheTtl(), config.getCacheMaxEntries(), clock);
    }

    /**
     * Creates a cache with the specified TTL.
     *
     * @param ttl        Time to live per entry, measured from the write
     * @param maxEntries Size bound; least recently used entries go first
     * @param clock      Time source for expiry
     */
    public ResponseCache(Duration ttl, long maxEntries, Clock clock) {
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .ticker(ticker)
                .build();
    }

    public static String searchKey(String queryHash) {
        return "search:" + queryHash;
    }

    public static String collectKey(String candidateId) {
        return "collect:" + candidateId;
    }

    public void put(String key, Object value) {
        cache.put(key, value);
    }

    /**
     * @return the live entry, or null when absent or expired
     */
    public Object get(String key) {
        return cache.getIfPresent(key);
    }

    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
    }

    /**
     * Removes all expired entries from the cache.
     */
    public void prune() {
        cache.cleanUp();
    }

    public long size() {
        return cache.estimatedSize();
    }
}
