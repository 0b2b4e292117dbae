package com.taskadmin.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.infrastructure.cache.GuavaCacheStore;
import com.taskadmin.test.support.InMemoryCacheStore;
import com.taskadmin.test.support.MutableClock;
import com.taskadmin.trigger.application.cache.TaskCache;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

public class TaskCacheTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    public void shouldReturnEmptyOnCleanMissAndValueAfterSet() {
        TaskCache cache = new TaskCache(new GuavaCacheStore(100), objectMapper, Duration.ofMinutes(5));

        Assertions.assertEquals(Optional.empty(), cache.get(42L));

        TaskDTO dto = task("42");
        cache.set(dto);

        Assertions.assertEquals(Optional.of(dto), cache.get(42L));
    }

    @Test
    public void shouldExpireEntryAfterTtl() {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-02T00:00:00Z"));
        TaskCache cache = new TaskCache(new GuavaCacheStore(100, clock), objectMapper, Duration.ofMinutes(5));
        cache.set(task("42"));

        clock.advance(Duration.ofMinutes(4));
        Assertions.assertTrue(cache.get(42L).isPresent());

        clock.advance(Duration.ofMinutes(1));
        Assertions.assertTrue(cache.get(42L).isEmpty());
    }

    @Test
    public void shouldRemoveEntryOnInvalidate() {
        TaskCache cache = new TaskCache(new GuavaCacheStore(100), objectMapper, Duration.ofMinutes(5));
        cache.set(task("42"));

        cache.invalidate(42L);

        Assertions.assertTrue(cache.get(42L).isEmpty());
    }

    @Test
    public void shouldSurfaceStoreFailureAsCacheUnavailable() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.setUnavailable(true);
        TaskCache cache = new TaskCache(store, objectMapper, Duration.ofMinutes(5));

        AppException readError = Assertions.assertThrows(AppException.class, () -> cache.get(42L));
        AppException writeError = Assertions.assertThrows(AppException.class, () -> cache.set(task("42")));

        Assertions.assertTrue(readError.is(ResponseCode.CACHE_UNAVAILABLE));
        Assertions.assertTrue(writeError.is(ResponseCode.CACHE_UNAVAILABLE));
    }

    @Test
    public void shouldDropUndecodableEntry() {
        InMemoryCacheStore store = new InMemoryCacheStore();
        store.putRaw("task:42", "[1,2");
        TaskCache cache = new TaskCache(store, objectMapper, Duration.ofMinutes(5));

        Assertions.assertTrue(cache.get(42L).isEmpty());
        Assertions.assertNull(store.raw("task:42"));
    }

    private TaskDTO task(String id) {
        TaskDTO dto = new TaskDTO();
        dto.setId(id);
        dto.setTaskName("nightly-crawl");
        dto.setStatus("Running");
        dto.setOwner("auth0|alice");
        dto.setCreatedAt(LocalDateTime.of(2025, 3, 2, 8, 30));
        return dto;
    }
}
