package com.taskadmin.domain.task.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 任务运行产物领域实体（只读，一经写入不再变更）
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
public class TaskRunArtifactEntity {

    /**
     * 外部执行实例 ID（分区键）
     */
    private UUID executionInstanceId;

    /**
     * 外部执行任务 ID
     */
    private UUID executionTaskId;

    /**
     * 产物 ID
     */
    private UUID artifactId;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 产物类型
     */
    private String artifactType;

    /**
     * 产物地址
     */
    private String url;

    /**
     * 内容类型
     */
    private String contentType;

    /**
     * 内容长度
     */
    private Long contentLength;

    /**
     * HTTP 状态码
     */
    private Integer statusCode;

    /**
     * 附加数据（自由格式）
     */
    private String additionalData;
}
