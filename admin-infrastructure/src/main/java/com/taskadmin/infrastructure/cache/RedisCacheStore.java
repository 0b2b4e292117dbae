package com.taskadmin.infrastructure.cache;

import com.taskadmin.domain.task.adapter.cache.ICacheStore;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Optional;

/**
 * 基于 Redis 的共享缓存存储，键格式为 {@code [prefix]cacheName:key}。
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
public class RedisCacheStore implements ICacheStore {

    private final StringRedisTemplate redisTemplate;
    private final String keyPrefix;

    public RedisCacheStore(StringRedisTemplate redisTemplate, String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.keyPrefix = StringUtils.defaultString(keyPrefix);
    }

    @Override
    public Optional<String> get(String cacheName, String key) {
        String redisKey = redisKey(cacheName, key);
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey));
        } catch (DataAccessException ex) {
            throw unavailable("get", redisKey, ex);
        }
    }

    @Override
    public void put(String cacheName, String key, String value, Duration ttl) {
        String redisKey = redisKey(cacheName, key);
        try {
            redisTemplate.opsForValue().set(redisKey, value, ttl);
        } catch (DataAccessException ex) {
            throw unavailable("put", redisKey, ex);
        }
    }

    @Override
    public void invalidate(String cacheName, String key) {
        String redisKey = redisKey(cacheName, key);
        try {
            redisTemplate.delete(redisKey);
        } catch (DataAccessException ex) {
            throw unavailable("invalidate", redisKey, ex);
        }
    }

    String redisKey(String cacheName, String key) {
        return keyPrefix + cacheName + ":" + key;
    }

    private AppException unavailable(String action, String redisKey, DataAccessException ex) {
        log.warn("Redis cache unavailable. action={}, key={}, error={}", action, redisKey, ex.getMessage());
        return new AppException(ResponseCode.CACHE_UNAVAILABLE, "Cache store unavailable on " + action, ex);
    }
}
