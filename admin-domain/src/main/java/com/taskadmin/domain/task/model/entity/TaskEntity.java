package com.taskadmin.domain.task.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务领域实体
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
public class TaskEntity {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 任务名称
     */
    private String taskName;

    /**
     * 任务定义（不透明的序列化载荷）
     */
    private String taskDefinition;

    /**
     * 提交人（身份提供方 subject）
     */
    private String owner;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 软删除时间
     */
    private LocalDateTime deletedAt;

    /**
     * 以提交人身份创建新任务
     */
    public static TaskEntity create(String taskName, String taskDefinition, String owner) {
        TaskEntity entity = new TaskEntity();
        LocalDateTime now = LocalDateTime.now();
        entity.setTaskName(taskName);
        entity.setTaskDefinition(taskDefinition);
        entity.setOwner(owner);
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    /**
     * 验证任务是否有效
     */
    public void validate() {
        if (taskName == null || taskName.trim().isEmpty()) {
            throw new IllegalStateException("Task name cannot be empty");
        }
        if (owner == null || owner.trim().isEmpty()) {
            throw new IllegalStateException("Task owner cannot be empty");
        }
    }

    /**
     * 覆盖名称与定义，并刷新更新时间
     */
    public void applyUpdate(String taskName, String taskDefinition) {
        this.taskName = taskName;
        this.taskDefinition = taskDefinition;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 标记为软删除
     */
    public void markDeleted() {
        LocalDateTime now = LocalDateTime.now();
        this.deletedAt = now;
        this.updatedAt = now;
    }

    /**
     * 检查是否已软删除
     */
    public boolean isDeleted() {
        return this.deletedAt != null;
    }
}
