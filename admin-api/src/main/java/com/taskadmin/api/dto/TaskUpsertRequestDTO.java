package com.taskadmin.api.dto;

import lombok.Data;

/**
 * 任务创建 / 更新请求 DTO。
 * <p>
 * taskDefinition 为不透明的序列化载荷，原样存储。
 * </p>
 */
@Data
public class TaskUpsertRequestDTO {

    private String taskName;
    private String taskDefinition;
}
