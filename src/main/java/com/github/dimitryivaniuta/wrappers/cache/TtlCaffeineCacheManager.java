package com.github.dimitryivaniuta.wrappers.cache;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.cache.support.AbstractCacheManager;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caffeine CacheManager that supports per-cache TTL via cache name convention:
 *
 *   "operation-results:ttl=100"   -> expireAfterWrite 100 milliseconds
 *   "operation-results"           -> no expiry (base builder only)
 *
 * Notes:
 * - Entries are process-local; nothing survives a restart.
 * - The optional size bound applies to expiring caches only. A cache without a TTL is
 *   permanent and never evicts by size.
 * - Caches are created lazily and kept in a ConcurrentHashMap so the same name always
 *   resolves to the same Cache instance.
 * IMPORTANT:
 * Caffeine builders are mutable. You MUST create a fresh builder per cache.
 * This manager therefore uses a Supplier<Caffeine<..>> factory.
 */
public final class TtlCaffeineCacheManager extends AbstractCacheManager {

    private static final Pattern TTL_PATTERN = Pattern.compile("^(?<base>.+?)(?::ttl=(?<ttl>\\d+))?$");
    private static final long MIN_TTL_MILLIS = 1;

    private final Supplier<Caffeine<Object, Object>> baseBuilderFactory;
    private final long expiringMaximumSize;
    private final Map<String, Cache> cacheMap = new ConcurrentHashMap<>();

    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory) {
        this(baseBuilderFactory, 0);
    }

    /**
     * @param expiringMaximumSize size bound for caches with a TTL; {@code <= 0} means unbounded
     */
    public TtlCaffeineCacheManager(Supplier<Caffeine<Object, Object>> baseBuilderFactory, long expiringMaximumSize) {
        this.baseBuilderFactory = Objects.requireNonNull(baseBuilderFactory, "baseBuilderFactory must not be null");
        this.expiringMaximumSize = expiringMaximumSize;
    }

    public static String cacheName(String base, Duration ttl) {
        return (ttl == null) ? base : base + ":ttl=" + ttl.toMillis();
    }

    @Override
    protected Collection<? extends Cache> loadCaches() {
        // no predefined caches; created lazily in getMissingCache(...)
        return List.of();
    }

    @Override
    protected Cache getMissingCache(String name) {
        return cacheMap.computeIfAbsent(name, this::createCache);
    }

    private Cache createCache(String name) {
        Long ttlMillis = parseTtlMillis(name);

        // fresh builder per cache (prevents "expireAfterWrite already set")
        Caffeine<Object, Object> builder = baseBuilderFactory.get();

        if (ttlMillis != null) {
            builder = builder.expireAfterWrite(Duration.ofMillis(ttlMillis));
            if (expiringMaximumSize > 0) {
                builder = builder.maximumSize(expiringMaximumSize);
            }
        }

        // full name (incl ":ttl=") so different TTLs become different caches
        return new CaffeineCache(name, builder.build());
    }

    static Long parseTtlMillis(String name) {
        if (name == null || name.isBlank()) return null;

        Matcher m = TTL_PATTERN.matcher(name.trim());
        if (!m.matches()) return null;

        String ttlGroup = m.group("ttl");
        if (ttlGroup == null) return null;

        try {
            return Math.max(MIN_TTL_MILLIS, Long.parseLong(ttlGroup));
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
