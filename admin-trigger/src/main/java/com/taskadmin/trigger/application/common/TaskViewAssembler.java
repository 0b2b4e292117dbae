package com.taskadmin.trigger.application.common;

import com.taskadmin.api.dto.TaskDTO;
import com.taskadmin.api.dto.TaskRunArtifactDTO;
import com.taskadmin.api.dto.TaskRunDTO;
import com.taskadmin.domain.task.adapter.repository.ITaskRunRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.domain.task.model.entity.TaskRunArtifactEntity;
import com.taskadmin.domain.task.model.entity.TaskRunEntity;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.TaskRunStatusEnum;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.UUID;

/**
 * 任务视图组装器：统一 TaskDTO / TaskRunDTO / TaskRunArtifactDTO 映射与任务当前状态推导。
 */
@Slf4j
@Component
public class TaskViewAssembler {

    private final ITaskRunRepository taskRunRepository;

    public TaskViewAssembler(ITaskRunRepository taskRunRepository) {
        this.taskRunRepository = taskRunRepository;
    }

    /**
     * 任务当前状态取最近一次运行的状态，没有运行记录时为 Pending。
     * 最近运行查询失败时抛出 MAPPING_ERROR。
     */
    public TaskDTO toTaskDTO(TaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDTO dto = new TaskDTO();
        dto.setId(toText(task.getId()));
        dto.setTaskName(task.getTaskName());
        dto.setTaskDefinition(task.getTaskDefinition());
        dto.setStatus(resolveCurrentStatus(task.getId()));
        dto.setOwner(task.getOwner());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setUpdatedAt(task.getUpdatedAt());
        dto.setDeletedAt(task.getDeletedAt());
        return dto;
    }

    public TaskRunDTO toTaskRunDTO(TaskRunEntity run) {
        if (run == null) {
            return null;
        }
        TaskRunDTO dto = new TaskRunDTO();
        dto.setId(toText(run.getId()));
        dto.setTaskId(toText(run.getTaskId()));
        dto.setStatus(run.getStatus());
        dto.setStartTime(run.getStartTime());
        dto.setEndTime(run.getEndTime());
        dto.setErrorMessage(run.getErrorMessage());
        dto.setExecutionInstanceId(run.getExecutionInstanceId());
        return dto;
    }

    public TaskRunArtifactDTO toArtifactDTO(TaskRunArtifactEntity artifact) {
        if (artifact == null) {
            return null;
        }
        TaskRunArtifactDTO dto = new TaskRunArtifactDTO();
        dto.setExecutionInstanceId(toText(artifact.getExecutionInstanceId()));
        dto.setExecutionTaskId(toText(artifact.getExecutionTaskId()));
        dto.setArtifactId(toText(artifact.getArtifactId()));
        dto.setCreatedAt(artifact.getCreatedAt());
        dto.setArtifactType(artifact.getArtifactType());
        dto.setUrl(artifact.getUrl());
        dto.setContentType(artifact.getContentType());
        dto.setContentLength(artifact.getContentLength());
        dto.setStatusCode(artifact.getStatusCode());
        dto.setAdditionalData(artifact.getAdditionalData());
        return dto;
    }

    private String resolveCurrentStatus(Long taskId) {
        if (taskId == null) {
            return TaskRunStatusEnum.PENDING.getCode();
        }
        TaskRunEntity latest;
        try {
            latest = taskRunRepository.findLatestByTaskId(taskId);
        } catch (AppException ex) {
            log.error("Resolve task status failed. taskId={}, errorCode={}, error={}", taskId, ex.getCode(), ex.getInfo());
            throw new AppException(ResponseCode.MAPPING_ERROR, "Failed to resolve status of task " + taskId, ex);
        }
        if (latest == null || latest.getStatus() == null) {
            return TaskRunStatusEnum.PENDING.getCode();
        }
        return latest.getStatus();
    }

    private String toText(Long value) {
        return value == null ? null : String.valueOf(value);
    }

    private String toText(UUID value) {
        return Objects.toString(value, null);
    }
}
