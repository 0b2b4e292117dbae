package com.taskadmin.infrastructure.repository.task;

import com.taskadmin.domain.task.adapter.repository.ITaskRepository;
import com.taskadmin.domain.task.model.entity.TaskEntity;
import com.taskadmin.infrastructure.dao.TaskDao;
import com.taskadmin.infrastructure.dao.po.TaskPO;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务仓储实现类。
 * <p>
 * 负责任务的持久化操作，包括：
 * <ul>
 *   <li>任务的新增、更新、软删除</li>
 *   <li>按 ID / 提交人查询（过滤已软删除记录）</li>
 *   <li>Entity与PO之间的相互转换</li>
 * </ul>
 * 存储层异常统一转换为 PERSISTENCE_ERROR。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
@Repository
public class TaskRepositoryImpl implements ITaskRepository {

    private final TaskDao taskDao;

    public TaskRepositoryImpl(TaskDao taskDao) {
        this.taskDao = taskDao;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        entity.validate();
        TaskPO po = toPO(entity);
        try {
            taskDao.insert(po);
        } catch (DataAccessException ex) {
            throw persistenceError("insert task", ex);
        }
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public boolean update(TaskEntity entity) {
        try {
            return taskDao.update(toPO(entity)) > 0;
        } catch (DataAccessException ex) {
            throw persistenceError("update task " + entity.getId(), ex);
        }
    }

    @Override
    public boolean softDelete(TaskEntity entity) {
        try {
            return taskDao.softDelete(entity.getId(), entity.getDeletedAt()) > 0;
        } catch (DataAccessException ex) {
            throw persistenceError("delete task " + entity.getId(), ex);
        }
    }

    @Override
    public TaskEntity findById(Long id) {
        try {
            return toEntity(taskDao.selectById(id));
        } catch (DataAccessException ex) {
            throw persistenceError("select task " + id, ex);
        }
    }

    @Override
    public List<TaskEntity> findByOwner(String owner) {
        try {
            return taskDao.selectByOwner(owner).stream()
                    .map(this::toEntity)
                    .collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw persistenceError("select tasks of owner " + owner, ex);
        }
    }

    private AppException persistenceError(String action, DataAccessException ex) {
        log.error("Task persistence failed. action={}, error={}", action, ex.getMessage());
        return new AppException(ResponseCode.PERSISTENCE_ERROR, "Failed to " + action, ex);
    }

    /**
     * PO 转换为 Entity
     */
    private TaskEntity toEntity(TaskPO po) {
        if (po == null) {
            return null;
        }
        TaskEntity entity = new TaskEntity();
        entity.setId(po.getId());
        entity.setTaskName(po.getTaskName());
        entity.setTaskDefinition(po.getTaskDefinition());
        entity.setOwner(po.getOwner());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setDeletedAt(po.getDeletedAt());
        return entity;
    }

    /**
     * Entity 转换为 PO
     */
    private TaskPO toPO(TaskEntity entity) {
        if (entity == null) {
            return null;
        }
        return TaskPO.builder()
                .id(entity.getId())
                .taskName(entity.getTaskName())
                .taskDefinition(entity.getTaskDefinition())
                .owner(entity.getOwner())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .deletedAt(entity.getDeletedAt())
                .build();
    }
}
