package com.taskadmin.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务运行 DTO。
 */
@Data
public class TaskRunDTO {

    private String id;
    private String taskId;
    private String status;
    private LocalDateTime startTime;
    private LocalDateTime endTime;
    private String errorMessage;
    private String executionInstanceId;
}
