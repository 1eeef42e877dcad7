package com.e2eq.twins.models.cache;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Expire-after-write cache driven by a {@link Clock}. A zero or negative expiration turns the
 * cache into a pass-through: nothing is retained and every lookup goes to the loader.
 */
public class TtlCache<K, V> {
    private final Cache<K, V> cache;

    public TtlCache(Duration expiration, Clock clock, long maximumSize) {
        if (expiration == null || expiration.isZero() || expiration.isNegative()) {
            this.cache = null;
        } else {
            this.cache = CacheBuilder.newBuilder()
                    .expireAfterWrite(expiration.toNanos(), TimeUnit.NANOSECONDS)
                    .maximumSize(maximumSize)
                    .ticker(tickerOf(clock))
                    .build();
        }
    }

    public boolean isEnabled() {
        return cache != null;
    }

    public Optional<V> get(K key) {
        return cache == null ? Optional.empty() : Optional.ofNullable(cache.getIfPresent(key));
    }

    /**
     * Returns the cached value or loads, stores and returns it. Loader exceptions propagate
     * unchanged and nothing is cached for the key.
     */
    public V get(K key, Function<K, V> loader) {
        if (cache == null) {
            return loader.apply(key);
        }
        V value = cache.getIfPresent(key);
        if (value == null) {
            value = loader.apply(key);
            if (value != null) {
                cache.put(key, value);
            }
        }
        return value;
    }

    public void put(K key, V value) {
        if (cache != null && value != null) {
            cache.put(key, value);
        }
    }

    public void invalidate(K key) {
        if (cache != null) {
            cache.invalidate(key);
        }
    }

    public void invalidateAll() {
        if (cache != null) {
            cache.invalidateAll();
        }
    }

    static Ticker tickerOf(Clock clock) {
        return new Ticker() {
            @Override
            public long read() {
                Instant now = clock.instant();
                return TimeUnit.SECONDS.toNanos(now.getEpochSecond()) + now.getNano();
            }
        };
    }
}
