package com.taskadmin.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 任务缓存存储配置，任务视图的 TTL 见 {@code app.cache.task-ttl}。
 */
@Data
@ConfigurationProperties(prefix = "app.cache")
public class TaskCacheProperties {

    /** 存储类型：memory（进程内 Guava）或 redis。 */
    private String type = "memory";

    /** 进程内缓存每个命名空间的最大条目数。 */
    private long maximumSize = 10_000L;

    /** Redis 键前缀。 */
    private String keyPrefix = "";
}
