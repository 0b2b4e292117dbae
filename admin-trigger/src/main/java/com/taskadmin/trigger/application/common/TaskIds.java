package com.taskadmin.trigger.application.common;

import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;

/**
 * 外部传入的任务 / 运行 ID 解析：必须是仅含 ASCII 数字的正整数，否则抛出 INVALID_ID。
 */
public final class TaskIds {

    private TaskIds() {
    }

    public static Long parse(String raw, String name) {
        String text = StringUtils.trimToEmpty(raw);
        if (text.isEmpty() || !text.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new AppException(ResponseCode.INVALID_ID, name + " 不是合法的正整数: " + raw);
        }
        long value;
        try {
            value = Long.parseLong(text);
        } catch (NumberFormatException ex) {
            throw new AppException(ResponseCode.INVALID_ID, name + " 超出范围: " + raw, ex);
        }
        if (value <= 0) {
            throw new AppException(ResponseCode.INVALID_ID, name + " 必须大于 0: " + raw);
        }
        return value;
    }
}
