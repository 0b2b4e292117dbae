package com.taskadmin.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 任务运行状态枚举。
 * <p>
 * 状态流转 PENDING -> RUNNING -> {SUCCEEDED, FAILED} 完全由外部执行系统驱动，本系统只读。
 * 外部系统可能写入此处未列出的状态（如 Cancelled），读取时原样透传。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public enum TaskRunStatusEnum {

    /**
     * 待处理 - 已创建，尚未开始执行；任务没有任何运行记录时同样视为此状态
     */
    PENDING("Pending"),

    /**
     * 运行中
     */
    RUNNING("Running"),

    /**
     * 已成功
     */
    SUCCEEDED("Succeeded"),

    /**
     * 已失败
     */
    FAILED("Failed");

    private final String code;

    TaskRunStatusEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 规范化存储中的状态：已知状态（忽略大小写，接受枚举名或 code）返回标准 code，
     * 未知状态去除首尾空白后原样返回，空白返回 null。
     */
    public static String normalize(String code) {
        if (code == null || code.trim().isEmpty()) {
            return null;
        }
        String trimmed = code.trim();
        for (TaskRunStatusEnum status : TaskRunStatusEnum.values()) {
            if (status.code.equalsIgnoreCase(trimmed) || status.name().equalsIgnoreCase(trimmed)) {
                return status.code;
            }
        }
        return trimmed;
    }
}
