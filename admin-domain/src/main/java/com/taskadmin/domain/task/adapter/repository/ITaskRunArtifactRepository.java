package com.taskadmin.domain.task.adapter.repository;

import com.taskadmin.domain.task.model.entity.TaskRunArtifactEntity;

import java.util.List;
import java.util.UUID;

/**
 * 任务运行产物仓储接口（宽表存储）
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public interface ITaskRunArtifactRepository {

    /**
     * 按外部执行实例 ID 分页查询产物，按存储原生顺序返回。
     *
     * @param executionInstanceId 外部执行实例 ID
     * @param limit 最多返回条数
     * @param offset 跳过条数
     * @return 至多 limit 条产物
     */
    List<TaskRunArtifactEntity> listByExecutionInstanceId(UUID executionInstanceId, int limit, int offset);
}
