package com.taskadmin.domain.task.adapter.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * 键值缓存存储端口。
 * <p>
 * 值统一为 JSON 字符串，按命名空间隔离。存储不可达时实现方抛出
 * {@code AppException(CACHE_UNAVAILABLE)}，未命中返回 {@link Optional#empty()}。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public interface ICacheStore {

    /**
     * 读取缓存值
     *
     * @param cacheName 命名空间
     * @param key 缓存键
     * @return 缓存值，未命中或已过期时为空
     */
    Optional<String> get(String cacheName, String key);

    /**
     * 写入缓存值
     *
     * @param cacheName 命名空间
     * @param key 缓存键
     * @param value 缓存值
     * @param ttl 存活时间
     */
    void put(String cacheName, String key, String value, Duration ttl);

    /**
     * 失效单个缓存项
     */
    void invalidate(String cacheName, String key);
}
