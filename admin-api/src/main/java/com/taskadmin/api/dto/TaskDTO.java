package com.taskadmin.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务 DTO。
 * <p>
 * ID 字符串化，状态取自最近一次运行（无运行时为 Pending）。也是任务缓存的存储单元。
 * </p>
 */
@Data
public class TaskDTO {

    private String id;
    private String taskName;
    private String taskDefinition;
    private String status;
    private String owner;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime deletedAt;
}
