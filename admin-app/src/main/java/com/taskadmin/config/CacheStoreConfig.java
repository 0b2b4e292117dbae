package com.taskadmin.config;

import com.taskadmin.domain.task.adapter.cache.ICacheStore;
import com.taskadmin.infrastructure.cache.GuavaCacheStore;
import com.taskadmin.infrastructure.cache.RedisCacheStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 缓存存储配置类。
 * <p>
 * 默认使用进程内 Guava 缓存；{@code app.cache.type=redis} 时切换为 Redis，多实例间共享。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
@Configuration
public class CacheStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    public ICacheStore guavaCacheStore(TaskCacheProperties properties) {
        log.info("Cache store: guava. maximumSize={}", properties.getMaximumSize());
        return new GuavaCacheStore(properties.getMaximumSize());
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.cache", name = "type", havingValue = "redis")
    public ICacheStore redisCacheStore(StringRedisTemplate stringRedisTemplate, TaskCacheProperties properties) {
        log.info("Cache store: redis. keyPrefix={}", properties.getKeyPrefix());
        return new RedisCacheStore(stringRedisTemplate, properties.getKeyPrefix());
    }

}
