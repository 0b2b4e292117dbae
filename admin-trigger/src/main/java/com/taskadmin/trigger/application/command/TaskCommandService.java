package com.taskadmin.trigger.application.command;

import com.taskadmin.api.dto.TaskUpsertRequestDTO;
import com.taskadmin.domain.task.adapter.repository.ITaskRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.trigger.application.cache.TaskCache;
import com.taskadmin.trigger.application.common.TaskIds;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * 任务写用例：创建、更新、软删除。
 * <p>
 * 创建不写缓存；更新与删除成功后失效对应缓存项，失效失败只记录日志。
 * </p>
 */
@Slf4j
@Service
public class TaskCommandService {

    private final ITaskRepository taskRepository;
    private final TaskCache taskCache;

    public TaskCommandService(ITaskRepository taskRepository, TaskCache taskCache) {
        this.taskRepository = taskRepository;
        this.taskCache = taskCache;
    }

    public TaskEntity createTask(TaskUpsertRequestDTO request, String ownerId) {
        requireTaskName(request);
        if (StringUtils.isBlank(ownerId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "ownerId 不能为空");
        }
        TaskEntity task = TaskEntity.create(request.getTaskName().trim(), request.getTaskDefinition(), ownerId);
        TaskEntity saved = taskRepository.save(task);
        log.info("Task created. taskId={}, owner={}", saved.getId(), ownerId);
        return saved;
    }

    public TaskEntity updateTask(TaskUpsertRequestDTO request, String ownerId, String taskId) {
        Long id = TaskIds.parse(taskId, "taskId");
        requireTaskName(request);
        TaskEntity task = requireTask(id);
        task.applyUpdate(request.getTaskName().trim(), request.getTaskDefinition());
        if (!taskRepository.update(task)) {
            throw new AppException(ResponseCode.NOT_FOUND, "Task not found: " + id);
        }
        evict(id);
        log.info("Task updated. taskId={}, operator={}", id, ownerId);
        return task;
    }

    public void deleteTask(String taskId, String ownerId) {
        Long id = TaskIds.parse(taskId, "taskId");
        TaskEntity task = requireTask(id);
        task.markDeleted();
        if (!taskRepository.softDelete(task)) {
            throw new AppException(ResponseCode.NOT_FOUND, "Task not found: " + id);
        }
        evict(id);
        log.info("Task deleted. taskId={}, operator={}", id, ownerId);
    }

    private TaskEntity requireTask(Long id) {
        TaskEntity task = taskRepository.findById(id);
        if (task == null) {
            log.info("Task not found. taskId={}", id);
            throw new AppException(ResponseCode.NOT_FOUND, "Task not found: " + id);
        }
        return task;
    }

    private void requireTaskName(TaskUpsertRequestDTO request) {
        if (request == null || StringUtils.isBlank(request.getTaskName())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "taskName 不能为空");
        }
    }

    private void evict(Long taskId) {
        try {
            taskCache.invalidate(taskId);
        } catch (AppException ex) {
            log.warn("Task cache invalidate failed. taskId={}, errorCode={}, error={}", taskId, ex.getCode(), ex.getInfo());
        }
    }
}
