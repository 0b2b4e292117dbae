package com.taskadmin.trigger.application.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.domain.task.adapter.cache.ICacheStore;
import com.taskadmin.types.common.Constants;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * 任务视图缓存（cache-aside）。
 * <p>
 * 以 JSON 形式存储 {@link TaskDTO}，键为 {@code task:{id}}，TTL 由 {@code app.cache.task-ttl} 控制。
 * 存储不可达时抛出 CACHE_UNAVAILABLE，由调用方决定降级；无法解码的缓存值视为未命中并失效。
 * </p>
 */
@Slf4j
@Component
public class TaskCache {

    private final ICacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    private final Counter hitCounter;
    private final Counter missCounter;
    private final Counter unavailableCounter;

    public TaskCache(ICacheStore cacheStore,
                     ObjectMapper objectMapper,
                     @Value("${app.cache.task-ttl:PT10M}") Duration ttl) {
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
        this.hitCounter = Counter.builder("admin.task.cache.hit.total").register(Metrics.globalRegistry);
        this.missCounter = Counter.builder("admin.task.cache.miss.total").register(Metrics.globalRegistry);
        this.unavailableCounter = Counter.builder("admin.task.cache.unavailable.total").register(Metrics.globalRegistry);
    }

    public Optional<TaskDTO> get(Long taskId) {
        String key = String.valueOf(taskId);
        Optional<String> payload;
        try {
            payload = cacheStore.get(Constants.TASK_CACHE_NAME, key);
        } catch (AppException ex) {
            unavailableCounter.increment();
            throw ex;
        }
        if (payload.isEmpty()) {
            missCounter.increment();
            return Optional.empty();
        }
        try {
            TaskDTO dto = objectMapper.readValue(payload.get(), TaskDTO.class);
            hitCounter.increment();
            return Optional.of(dto);
        } catch (JsonProcessingException ex) {
            log.warn("Discard undecodable task cache entry. taskId={}, error={}", taskId, ex.getOriginalMessage());
            missCounter.increment();
            try {
                invalidate(taskId);
            } catch (AppException invalidateEx) {
                log.warn("Task cache invalidate failed. taskId={}, error={}", taskId, invalidateEx.getInfo());
            }
            return Optional.empty();
        }
    }

    public void set(TaskDTO task) {
        if (task == null || task.getId() == null) {
            return;
        }
        String payload;
        try {
            payload = objectMapper.writeValueAsString(task);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.MAPPING_ERROR, "Failed to encode task " + task.getId(), ex);
        }
        try {
            cacheStore.put(Constants.TASK_CACHE_NAME, task.getId(), payload, ttl);
        } catch (AppException ex) {
            unavailableCounter.increment();
            throw ex;
        }
    }

    public void invalidate(Long taskId) {
        try {
            cacheStore.invalidate(Constants.TASK_CACHE_NAME, String.valueOf(taskId));
        } catch (AppException ex) {
            unavailableCounter.increment();
            throw ex;
        }
    }
}
