package com.taskadmin.trigger.application.query;

import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.api.dto.TaskRunArtifactDTO;
import com.taskadmin.api.dto.TaskRunDTO;
import com.taskadmin.domain.task.adapter.repository.ITaskRepository;
import com.taskadmin.domain.task.adapter.repository.ITaskRunArtifactRepository;
import com.taskadmin.domain.task.adapter.repository.ITaskRunRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.domain.task.model.entity.TaskRunEntity;
import com.taskadmin.trigger.application.cache.TaskCache;
import com.taskadmin.trigger.application.common.TaskIds;
import com.taskadmin.trigger.application.common.TaskViewAssembler;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * 任务读用例：任务视图（带缓存）、运行记录、运行产物分页。
 */
@Slf4j
@Service
public class TaskQueryService {

    private final ITaskRepository taskRepository;
    private final ITaskRunRepository taskRunRepository;
    private final ITaskRunArtifactRepository taskRunArtifactRepository;
    private final TaskCache taskCache;
    private final TaskViewAssembler taskViewAssembler;
    private final int maxArtifactPageSize;

    public TaskQueryService(ITaskRepository taskRepository,
                            ITaskRunRepository taskRunRepository,
                            ITaskRunArtifactRepository taskRunArtifactRepository,
                            TaskCache taskCache,
                            TaskViewAssembler taskViewAssembler,
                            @Value("${app.task.artifact.max-page-size:100}") int maxArtifactPageSize) {
        this.taskRepository = taskRepository;
        this.taskRunRepository = taskRunRepository;
        this.taskRunArtifactRepository = taskRunArtifactRepository;
        this.taskCache = taskCache;
        this.taskViewAssembler = taskViewAssembler;
        this.maxArtifactPageSize = Math.max(1, maxArtifactPageSize);
    }

    public List<TaskDTO> getTasksByUser(String userId) {
        if (StringUtils.isBlank(userId)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userId 不能为空");
        }
        List<TaskEntity> tasks = taskRepository.findByOwner(userId);
        return tasks.stream()
                .map(taskViewAssembler::toTaskDTO)
                .collect(Collectors.toList());
    }

    public TaskDTO getTaskById(String taskId) {
        Long id = TaskIds.parse(taskId, "taskId");
        Optional<TaskDTO> cached = readCache(id);
        if (cached.isPresent()) {
            return cached.get();
        }
        TaskEntity task = taskRepository.findById(id);
        if (task == null) {
            log.info("Task not found. taskId={}", id);
            throw new AppException(ResponseCode.NOT_FOUND, "Task not found: " + id);
        }
        TaskDTO dto = taskViewAssembler.toTaskDTO(task);
        writeCache(dto);
        return dto;
    }

    public List<TaskRunDTO> listTaskRuns(String taskId) {
        Long id = TaskIds.parse(taskId, "taskId");
        return taskRunRepository.findByTaskId(id).stream()
                .map(taskViewAssembler::toTaskRunDTO)
                .collect(Collectors.toList());
    }

    /**
     * 运行产物分页：offset = (page - 1) * pageSize，pageSize 上限为 app.task.artifact.max-page-size。
     */
    public List<TaskRunArtifactDTO> getTaskRunArtifacts(String taskRunId, int page, int pageSize) {
        Long runId = TaskIds.parse(taskRunId, "taskRunId");
        if (page < 1 || pageSize < 1) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "page 与 pageSize 必须大于 0, page=" + page + ", pageSize=" + pageSize);
        }
        TaskRunEntity run = taskRunRepository.findById(runId);
        if (run == null) {
            log.info("Task run not found. taskRunId={}", runId);
            throw new AppException(ResponseCode.NOT_FOUND, "Task run not found: " + runId);
        }
        UUID executionInstanceId;
        try {
            executionInstanceId = run.parseExecutionInstanceId();
        } catch (IllegalArgumentException ex) {
            log.warn("Malformed execution instance id. taskRunId={}, executionInstanceId={}",
                    runId, run.getExecutionInstanceId());
            throw new AppException(ResponseCode.INVALID_EXTERNAL_ID,
                    "Malformed execution instance id of task run " + runId, ex);
        }
        int limit = Math.min(pageSize, maxArtifactPageSize);
        long offset = (long) (page - 1) * limit;
        if (offset > Integer.MAX_VALUE) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "page 超出范围, page=" + page);
        }
        return taskRunArtifactRepository.listByExecutionInstanceId(executionInstanceId, limit, (int) offset).stream()
                .map(taskViewAssembler::toArtifactDTO)
                .collect(Collectors.toList());
    }

    private Optional<TaskDTO> readCache(Long taskId) {
        try {
            return taskCache.get(taskId);
        } catch (AppException ex) {
            log.warn("Task cache read failed, fallback to store. taskId={}, errorCode={}, error={}",
                    taskId, ex.getCode(), ex.getInfo());
            return Optional.empty();
        }
    }

    private void writeCache(TaskDTO dto) {
        try {
            taskCache.set(dto);
        } catch (AppException ex) {
            log.warn("Task cache write failed. taskId={}, errorCode={}, error={}", dto.getId(), ex.getCode(), ex.getInfo());
        }
    }
}
