package com.taskadmin.infrastructure.repository.task;

import com.taskadmin.domain.task.adapter.repository.ITaskRunRepository;
import com.taskadmin.domain.task.model.entity.TaskRunEntity;
import com.taskadmin.infrastructure.dao.TaskRunDao;
import com.taskadmin.infrastructure.dao.po.TaskRunPO;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.TaskRunStatusEnum;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务运行记录仓储实现类（只读）。
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class TaskRunRepositoryImpl implements ITaskRunRepository {

    private final TaskRunDao taskRunDao;

    public TaskRunRepositoryImpl(TaskRunDao taskRunDao) {
        this.taskRunDao = taskRunDao;
    }

    @Override
    public TaskRunEntity findById(Long id) {
        try {
            return toEntity(taskRunDao.selectById(id));
        } catch (DataAccessException ex) {
            throw persistenceError("select task run " + id, ex);
        }
    }

    @Override
    public List<TaskRunEntity> findByTaskId(Long taskId) {
        try {
            return taskRunDao.selectByTaskId(taskId).stream()
                    .map(this::toEntity)
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw persistenceError("select runs of task " + taskId, ex);
        }
    }

    @Override
    public TaskRunEntity findLatestByTaskId(Long taskId) {
        try {
            return toEntity(taskRunDao.selectLatestByTaskId(taskId));
        } catch (DataAccessException ex) {
            throw persistenceError("select latest run of task " + taskId, ex);
        }
    }

    private AppException persistenceError(String action, DataAccessException ex) {
        log.error("Task run persistence failed. action={}, error={}", action, ex.getMessage());
        return new AppException(ResponseCode.PERSISTENCE_ERROR, "Failed to " + action, ex);
    }

    /**
     * PO 转换为 Entity
     */
    private TaskRunEntity toEntity(TaskRunPO po) {
        if (po == null) {
            return null;
        }
        TaskRunEntity entity = new TaskRunEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setStatus(TaskRunStatusEnum.normalize(po.getStatus()));
        entity.setStartTime(po.getStartTime());
        entity.setEndTime(po.getEndTime());
        entity.setErrorMessage(po.getErrorMessage());
        entity.setExecutionInstanceId(po.getExecutionInstanceId());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
