package com.taskadmin.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务运行记录 PO
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskRunPO {

    /**
     * 主键 ID
     */
    private Long id;

    /**
     * 任务 ID (关联 tasks.id)
     */
    private Long taskId;

    /**
     * 运行状态 code
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
     * 外部执行实例 ID
     */
    private String executionInstanceId;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
