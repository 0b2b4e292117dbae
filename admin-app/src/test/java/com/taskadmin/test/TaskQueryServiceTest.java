package com.taskadmin.test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.api.dto.TaskRunArtifactDTO;
import com.taskadmin.api.dto.TaskRunDTO;
import com.taskadmin.domain.task.adapter.repository.ITaskRunArtifactRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.domain.task.model.entity.TaskRunArtifactEntity;
import com.taskadmin.domain.task.model.entity.TaskRunEntity;
import com.taskadmin.test.support.InMemoryCacheStore;
import com.taskadmin.test.support.InMemoryTaskRepository;
import com.taskadmin.test.support.InMemoryTaskRunRepository;
import com.taskadmin.test.support.TaskFixtures;
import com.taskadmin.trigger.application.cache.TaskCache;
import com.taskadmin.trigger.application.common.TaskViewAssembler;
import com.taskadmin.trigger.application.query.TaskQueryService;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.TaskRunStatusEnum;
import com.taskadmin.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TaskQueryServiceTest {

    private static final UUID INSTANCE_ID = UUID.fromString("1f0e9a5c-7d1b-4c58-9b0e-3a2f6c0d4e11");

    private InMemoryTaskRepository taskRepository;
    private InMemoryTaskRunRepository taskRunRepository;
    private InMemoryCacheStore cacheStore;
    private ITaskRunArtifactRepository artifactRepository;
    private TaskQueryService service;

    @BeforeEach
    public void setUp() {
        taskRepository = new InMemoryTaskRepository();
        taskRunRepository = new InMemoryTaskRunRepository();
        cacheStore = new InMemoryCacheStore();
        artifactRepository = mock(ITaskRunArtifactRepository.class);
        when(artifactRepository.listByExecutionInstanceId(any(), anyInt(), anyInt())).thenReturn(Collections.emptyList());
        TaskCache taskCache = new TaskCache(cacheStore, new ObjectMapper().findAndRegisterModules(), Duration.ofMinutes(10));
        service = new TaskQueryService(taskRepository, taskRunRepository, artifactRepository, taskCache,
                new TaskViewAssembler(taskRunRepository), 100);
    }

    @Test
    public void shouldDeriveStatusFromLatestRunAndServeSecondReadFromCache() {
        taskRepository.put(TaskFixtures.task(42L, "nightly-crawl", "auth0|owner"));
        TaskRunEntity failed = TaskFixtures.run(7L, 42L, TaskRunStatusEnum.FAILED, LocalDateTime.now());
        failed.setErrorMessage("oom");
        taskRunRepository.put(failed);

        TaskDTO first = service.getTaskById("42");
        Assertions.assertEquals("42", first.getId());
        Assertions.assertEquals("Failed", first.getStatus());
        Assertions.assertEquals(1, taskRepository.getFindByIdCalls());
        Assertions.assertNotNull(cacheStore.raw("task:42"));

        TaskDTO second = service.getTaskById("42");
        Assertions.assertEquals(first, second);
        Assertions.assertEquals(1, taskRepository.getFindByIdCalls());
    }

    @Test
    public void shouldReportPendingWhenTaskHasNoRuns() {
        taskRepository.put(TaskFixtures.task(5L, "fresh", "auth0|owner"));

        Assertions.assertEquals("Pending", service.getTaskById("5").getStatus());
    }

    @Test
    public void shouldPickMostRecentlyCreatedRun() {
        taskRepository.put(TaskFixtures.task(8L, "retry", "auth0|owner"));
        LocalDateTime base = LocalDateTime.of(2025, 3, 1, 10, 0);
        taskRunRepository.put(TaskFixtures.run(1L, 8L, TaskRunStatusEnum.FAILED, base));
        taskRunRepository.put(TaskFixtures.run(2L, 8L, TaskRunStatusEnum.RUNNING, base.plusMinutes(5)));

        Assertions.assertEquals("Running", service.getTaskById("8").getStatus());
    }

    @Test
    public void shouldPassThroughStatusOutsideKnownSet() {
        taskRepository.put(TaskFixtures.task(9L, "halted", "auth0|owner"));
        taskRunRepository.put(TaskFixtures.run(3L, 9L, "Cancelled", LocalDateTime.now()));

        Assertions.assertEquals("Cancelled", service.getTaskById("9").getStatus());
        Assertions.assertEquals("Cancelled", service.getTasksByUser("auth0|owner").get(0).getStatus());
        Assertions.assertEquals("Cancelled", service.listTaskRuns("9").get(0).getStatus());
    }

    @Test
    public void shouldRejectMalformedTaskIds() {
        for (String raw : new String[]{"abc", "0", "-3", "", " ", "1.5", "99999999999999999999", "\uFF14\uFF12", "+42"}) {
            AppException ex = Assertions.assertThrows(AppException.class, () -> service.getTaskById(raw));
            Assertions.assertTrue(ex.is(ResponseCode.INVALID_ID), "input=" + raw);
        }
        Assertions.assertEquals(0, taskRepository.getFindByIdCalls());
    }

    @Test
    public void shouldReturnNotFoundForMissingTask() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.getTaskById("999"));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        Assertions.assertNull(cacheStore.raw("task:999"));
    }

    @Test
    public void shouldFallBackToStoreWhenCacheUnavailable() {
        taskRepository.put(TaskFixtures.task(42L, "nightly-crawl", "auth0|owner"));
        cacheStore.setUnavailable(true);

        TaskDTO dto = service.getTaskById("42");

        Assertions.assertEquals("nightly-crawl", dto.getTaskName());
        Assertions.assertEquals(1, taskRepository.getFindByIdCalls());
    }

    @Test
    public void shouldTreatUndecodableCacheEntryAsMiss() {
        taskRepository.put(TaskFixtures.task(42L, "nightly-crawl", "auth0|owner"));
        cacheStore.putRaw("task:42", "{not-json");

        TaskDTO dto = service.getTaskById("42");

        Assertions.assertEquals("42", dto.getId());
        Assertions.assertEquals(1, taskRepository.getFindByIdCalls());
        Assertions.assertTrue(cacheStore.raw("task:42").contains("nightly-crawl"));
    }

    @Test
    public void shouldListOnlyLiveTasksOfOwner() {
        taskRepository.put(TaskFixtures.task(1L, "a", "auth0|alice"));
        taskRepository.put(TaskFixtures.task(2L, "b", "auth0|bob"));
        TaskEntity deleted = TaskFixtures.task(3L, "c", "auth0|alice");
        deleted.markDeleted();
        taskRepository.put(deleted);

        List<TaskDTO> tasks = service.getTasksByUser("auth0|alice");

        Assertions.assertEquals(1, tasks.size());
        Assertions.assertEquals("1", tasks.get(0).getId());
        Assertions.assertEquals("Pending", tasks.get(0).getStatus());
    }

    @Test
    public void shouldFailWholeListingWhenLatestRunLookupFails() {
        taskRepository.put(TaskFixtures.task(1L, "a", "auth0|alice"));
        taskRunRepository.failLatestLookupWith(new AppException(ResponseCode.PERSISTENCE_ERROR, "db down"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.getTasksByUser("auth0|alice"));
        Assertions.assertTrue(ex.is(ResponseCode.MAPPING_ERROR));
    }

    @Test
    public void shouldListRunsOfTask() {
        taskRunRepository.put(TaskFixtures.run(1L, 8L, TaskRunStatusEnum.SUCCEEDED, LocalDateTime.now()));
        taskRunRepository.put(TaskFixtures.run(2L, 9L, TaskRunStatusEnum.FAILED, LocalDateTime.now()));

        List<TaskRunDTO> runs = service.listTaskRuns("8");

        Assertions.assertEquals(1, runs.size());
        Assertions.assertEquals("8", runs.get(0).getTaskId());
        Assertions.assertEquals("Succeeded", runs.get(0).getStatus());
    }

    @Test
    public void shouldRequestArtifactsAtPageOffset() {
        taskRunRepository.put(runWithInstance(11L, INSTANCE_ID.toString()));
        TaskRunArtifactEntity artifact = new TaskRunArtifactEntity();
        artifact.setExecutionInstanceId(INSTANCE_ID);
        artifact.setArtifactId(UUID.randomUUID());
        artifact.setUrl("https://example.com/report.html");
        artifact.setStatusCode(200);
        when(artifactRepository.listByExecutionInstanceId(INSTANCE_ID, 10, 20)).thenReturn(List.of(artifact));

        List<TaskRunArtifactDTO> page3 = service.getTaskRunArtifacts("11", 3, 10);
        service.getTaskRunArtifacts("11", 1, 25);

        Assertions.assertEquals(1, page3.size());
        Assertions.assertEquals(INSTANCE_ID.toString(), page3.get(0).getExecutionInstanceId());
        Assertions.assertEquals(200, page3.get(0).getStatusCode());
        verify(artifactRepository).listByExecutionInstanceId(INSTANCE_ID, 10, 20);
        verify(artifactRepository).listByExecutionInstanceId(INSTANCE_ID, 25, 0);
    }

    @Test
    public void shouldClampArtifactPageSize() {
        taskRunRepository.put(runWithInstance(11L, INSTANCE_ID.toString()));

        service.getTaskRunArtifacts("11", 2, 5000);

        verify(artifactRepository).listByExecutionInstanceId(INSTANCE_ID, 100, 100);
    }

    @Test
    public void shouldRejectInvalidArtifactPaging() {
        taskRunRepository.put(runWithInstance(11L, INSTANCE_ID.toString()));

        AppException zeroPage = Assertions.assertThrows(AppException.class, () -> service.getTaskRunArtifacts("11", 0, 10));
        AppException zeroSize = Assertions.assertThrows(AppException.class, () -> service.getTaskRunArtifacts("11", 1, 0));

        Assertions.assertTrue(zeroPage.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(zeroSize.is(ResponseCode.ILLEGAL_PARAMETER));
        verify(artifactRepository, never()).listByExecutionInstanceId(any(), anyInt(), anyInt());
    }

    @Test
    public void shouldRejectMalformedExecutionInstanceId() {
        String[] malformed = {"not-a-uuid", "1-2-3-4-5", "1f0e9a5c7d1b4c589b0e3a2f6c0d4e11",
                "1f0e9a5c-7d1b-4c58-9b0e-3a2f6c0d4e1", "{1f0e9a5c-7d1b-4c58-9b0e-3a2f6c0d4e11}"};
        long runId = 12L;
        for (String raw : malformed) {
            taskRunRepository.put(runWithInstance(runId, raw));
            String taskRunId = String.valueOf(runId);

            AppException ex = Assertions.assertThrows(AppException.class,
                    () -> service.getTaskRunArtifacts(taskRunId, 1, 10));

            Assertions.assertTrue(ex.is(ResponseCode.INVALID_EXTERNAL_ID), "input=" + raw);
            runId++;
        }
        verify(artifactRepository, never()).listByExecutionInstanceId(any(), anyInt(), anyInt());
    }

    @Test
    public void shouldAcceptUpperCaseExecutionInstanceId() {
        taskRunRepository.put(runWithInstance(20L, INSTANCE_ID.toString().toUpperCase()));

        service.getTaskRunArtifacts("20", 1, 10);

        verify(artifactRepository).listByExecutionInstanceId(INSTANCE_ID, 10, 0);
    }

    @Test
    public void shouldReturnNotFoundForMissingRun() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.getTaskRunArtifacts("404", 1, 10));
        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        verify(artifactRepository, never()).listByExecutionInstanceId(eq(INSTANCE_ID), anyInt(), anyInt());
    }

    private TaskRunEntity runWithInstance(Long id, String executionInstanceId) {
        TaskRunEntity run = TaskFixtures.run(id, 42L, TaskRunStatusEnum.SUCCEEDED, LocalDateTime.now());
        run.setExecutionInstanceId(executionInstanceId);
        return run;
    }
}
