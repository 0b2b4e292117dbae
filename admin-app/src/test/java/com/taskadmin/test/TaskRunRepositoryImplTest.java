package com.taskadmin.test;

import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.domain.task.model.entity.TaskRunEntity;
import com.taskadmin.infrastructure.dao.TaskRunDao;
import com.taskadmin.infrastructure.dao.po.TaskRunPO;
import com.taskadmin.infrastructure.repository.task.TaskRunRepositoryImpl;
import com.taskadmin.test.support.TaskFixtures;
import com.taskadmin.trigger.application.common.TaskViewAssembler;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.LocalDateTime;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class TaskRunRepositoryImplTest {

    private TaskRunDao taskRunDao;
    private TaskRunRepositoryImpl repository;

    @BeforeEach
    public void setUp() {
        taskRunDao = mock(TaskRunDao.class);
        repository = new TaskRunRepositoryImpl(taskRunDao);
    }

    @Test
    public void shouldKeepExternalStatusOutsideKnownSet() {
        when(taskRunDao.selectLatestByTaskId(42L)).thenReturn(po(1L, 42L, "Cancelled"));

        TaskDTO dto = new TaskViewAssembler(repository).toTaskDTO(TaskFixtures.task(42L, "crawl", "auth0|owner"));

        Assertions.assertEquals("Cancelled", dto.getStatus());
    }

    @Test
    public void shouldNormalizeKnownStatusCodes() {
        when(taskRunDao.selectByTaskId(42L)).thenReturn(List.of(
                po(1L, 42L, "succeeded"), po(2L, 42L, "RUNNING"), po(3L, 42L, " "), po(4L, 42L, "Timed Out ")));

        List<TaskRunEntity> runs = repository.findByTaskId(42L);

        Assertions.assertEquals("Succeeded", runs.get(0).getStatus());
        Assertions.assertEquals("Running", runs.get(1).getStatus());
        Assertions.assertNull(runs.get(2).getStatus());
        Assertions.assertEquals("Timed Out", runs.get(3).getStatus());
    }

    @Test
    public void shouldReportPendingWhenLatestRunHasBlankStatus() {
        when(taskRunDao.selectLatestByTaskId(7L)).thenReturn(po(1L, 7L, ""));

        TaskDTO dto = new TaskViewAssembler(repository).toTaskDTO(TaskFixtures.task(7L, "crawl", "auth0|owner"));

        Assertions.assertEquals("Pending", dto.getStatus());
    }

    @Test
    public void shouldTranslateDataAccessFailure() {
        when(taskRunDao.selectById(5L)).thenThrow(new QueryTimeoutException("statement timeout"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> repository.findById(5L));

        Assertions.assertTrue(ex.is(ResponseCode.PERSISTENCE_ERROR));
    }

    private TaskRunPO po(Long id, Long taskId, String status) {
        return TaskRunPO.builder()
                .id(id)
                .taskId(taskId)
                .status(status)
                .createdAt(LocalDateTime.of(2025, 3, 1, 10, 0))
                .build();
    }
}
