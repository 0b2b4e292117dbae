package com.taskadmin.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 任务运行产物 DTO。
 */
@Data
public class TaskRunArtifactDTO {

    private String executionInstanceId;
    private String executionTaskId;
    private String artifactId;
    private LocalDateTime createdAt;
    private String artifactType;
    private String url;
    private String contentType;
    private Long contentLength;
    private Integer statusCode;
    private String additionalData;
}
