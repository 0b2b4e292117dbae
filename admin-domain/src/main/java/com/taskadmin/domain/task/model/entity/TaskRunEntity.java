package com.taskadmin.domain.task.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * 任务运行记录领域实体
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
public class TaskRunEntity {

    private static final Pattern CANONICAL_UUID = Pattern.compile(
            "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 所属任务 ID
     */
    private Long taskId;

    /**
     * 运行状态 code，由外部执行系统写入，可能超出 {@code TaskRunStatusEnum} 的取值
     */
    private String status;

    /**
     * 开始时间
     */
    private LocalDateTime startTime;

    /**
     * 结束时间
     */
    private LocalDateTime endTime;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 外部执行实例 ID（UUID 文本，用于关联宽表中的产物）
     */
    private String executionInstanceId;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 解析外部执行实例 ID
     *
     * @throws IllegalArgumentException 不是 8-4-4-4-12 的标准 UUID 文本时抛出
     */
    public UUID parseExecutionInstanceId() {
        if (executionInstanceId == null || executionInstanceId.trim().isEmpty()) {
            throw new IllegalArgumentException("Execution instance id is empty");
        }
        String text = executionInstanceId.trim();
        if (!CANONICAL_UUID.matcher(text).matches()) {
            throw new IllegalArgumentException("Execution instance id is not a canonical UUID: " + text);
        }
        return UUID.fromString(text);
    }
}
