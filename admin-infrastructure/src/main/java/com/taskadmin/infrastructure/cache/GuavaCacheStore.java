package com.taskadmin.infrastructure.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.taskadmin.domain.task.adapter.cache.ICacheStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于 Guava Cache 的进程内缓存存储。
 * <p>
 * 每个命名空间一个 {@link Cache} 实例，容量上限由 maximumSize 控制。
 * Guava 只支持统一的写后过期，条目级 TTL 通过记录过期时刻并在读取时判断实现。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
public class GuavaCacheStore implements ICacheStore {

    private final ConcurrentMap<String, Cache<String, CachedValue>> caches = new ConcurrentHashMap<>();
    private final long maximumSize;
    private final Clock clock;

    public GuavaCacheStore(long maximumSize) {
        this(maximumSize, Clock.systemUTC());
    }

    public GuavaCacheStore(long maximumSize, Clock clock) {
        this.maximumSize = maximumSize;
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        Cache<String, CachedValue> cache = caches.get(cacheName);
        if (cache == null) {
            return Optional.empty();
        }
        CachedValue cached = cache.getIfPresent(key);
        if (cached == null) {
            return Optional.empty();
        }
        if (cached.isExpired(clock.instant())) {
            cache.invalidate(key);
            return Optional.empty();
        }
        return Optional.of(cached.value());
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        cacheOf(cacheName).put(key, new CachedValue(value, expiresAt));
    }

    @Override
    public void invalidate(String cacheName, String key) {
        Cache<String, CachedValue> cache = caches.get(cacheName);
        if (cache != null) {
            cache.invalidate(key);
        }
    }

    private Cache<String, CachedValue> cacheOf(String cacheName) {
        return caches.computeIfAbsent(cacheName, name -> {
            log.info("Create local cache. cacheName={}, maximumSize={}", name, maximumSize);
            return CacheBuilder.newBuilder()
                    .maximumSize(maximumSize)
                    .build();
        });
    }

    private record CachedValue(String value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
