package com.taskadmin.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 本地用户角色枚举。
 * <p>
 * USER / MEMBER / ADMIN 与身份提供方的角色对象一一对应；
 * UNKNOWN 仅作为无法识别的外部角色 ID 的映射结果，禁止用于分配。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public enum UserRoleEnum {

    USER("User"),

    MEMBER("Member"),

    ADMIN("Admin"),

    UNKNOWN("Unknown");

    private final String code;

    UserRoleEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 是否为可分配角色。
     */
    public boolean isAssignable() {
        return this != UNKNOWN;
    }

    /**
     * 宽松解析（大小写不敏感，接受枚举名或 code），无法识别时返回 null。
     */
    public static UserRoleEnum parse(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (UserRoleEnum role : UserRoleEnum.values()) {
            if (role.code.equalsIgnoreCase(trimmed) || role.name().equalsIgnoreCase(trimmed)) {
                return role;
            }
        }
        return null;
    }
}
