package com.taskadmin.domain.task.adapter.repository;

import com.taskadmin.domain.task.model.entity.TaskEntity;

import java.util.List;

/**
 * 任务仓储接口（已软删除的任务对所有查询不可见）
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public interface ITaskRepository {

    /**
     * 保存任务，回填主键
     */
    TaskEntity save(TaskEntity entity);

    /**
     * 更新名称、定义与更新时间
     */
    boolean update(TaskEntity entity);

    /**
     * 软删除
     */
    boolean softDelete(TaskEntity entity);

    /**
     * 根据 ID 查询
     */
    TaskEntity findById(Long id);

    /**
     * 根据提交人查询
     */
    List<TaskEntity> findByOwner(String owner);
}
