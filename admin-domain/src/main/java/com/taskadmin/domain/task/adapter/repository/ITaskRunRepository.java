package com.taskadmin.domain.task.adapter.repository;

import com.taskadmin.domain.task.model.entity.TaskRunEntity;

import java.util.List;

/**
 * 任务运行记录仓储接口（只读）
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public interface ITaskRunRepository {

    /**
     * 根据 ID 查询
     */
    TaskRunEntity findById(Long id);

    /**
     * 根据任务 ID 查询全部运行记录
     */
    List<TaskRunEntity> findByTaskId(Long taskId);

    /**
     * 查询任务最近创建的一次运行，不存在时返回 null
     */
    TaskRunEntity findLatestByTaskId(Long taskId);
}
