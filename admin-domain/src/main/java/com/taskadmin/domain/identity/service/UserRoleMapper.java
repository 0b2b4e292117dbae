package com.taskadmin.domain.identity.service;

import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.UserRoleEnum;
import com.taskadmin.types.exception.AppException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * 本地角色与身份提供方角色对象的双向映射。
 * <p>
 * 本地 -> 外部 为全函数（USER / MEMBER / ADMIN 必须都有对应外部角色，UNKNOWN 抛 INVALID_ROLE）；
 * 外部 -> 本地 为偏函数，无法识别的外部角色 ID 统一映射为 UNKNOWN。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
public class UserRoleMapper {

    private final Map<UserRoleEnum, ExternalRole> localToExternal;
    private final Map<String, UserRoleEnum> externalIdToLocal;

    public UserRoleMapper(Map<UserRoleEnum, ExternalRole> catalog) {
        if (catalog == null) {
            throw new IllegalStateException("Role catalog cannot be null");
        }
        Map<UserRoleEnum, ExternalRole> forward = new EnumMap<>(UserRoleEnum.class);
        Map<String, UserRoleEnum> backward = new HashMap<>();
        for (UserRoleEnum role : UserRoleEnum.values()) {
            if (!role.isAssignable()) {
                if (catalog.containsKey(role)) {
                    throw new IllegalStateException("Role " + role + " cannot be mapped to an external role");
                }
                continue;
            }
            ExternalRole external = catalog.get(role);
            if (external == null || external.id() == null || external.id().trim().isEmpty()) {
                throw new IllegalStateException("External role id missing for " + role);
            }
            UserRoleEnum previous = backward.put(external.id(), role);
            if (previous != null) {
                throw new IllegalStateException("External role id " + external.id()
                        + " mapped to both " + previous + " and " + role);
            }
            forward.put(role, external);
        }
        this.localToExternal = Collections.unmodifiableMap(forward);
        this.externalIdToLocal = Collections.unmodifiableMap(backward);
    }

    public static UserRoleMapper of(ExternalRole user, ExternalRole member, ExternalRole admin) {
        Map<UserRoleEnum, ExternalRole> catalog = new EnumMap<>(UserRoleEnum.class);
        catalog.put(UserRoleEnum.USER, user);
        catalog.put(UserRoleEnum.MEMBER, member);
        catalog.put(UserRoleEnum.ADMIN, admin);
        return new UserRoleMapper(catalog);
    }

    /**
     * 本地角色映射为外部角色对象。
     *
     * @throws AppException INVALID_ROLE 角色无外部对应（UNKNOWN 或 null）
     */
    public ExternalRole toExternal(UserRoleEnum role) {
        ExternalRole external = role == null ? null : localToExternal.get(role);
        if (external == null) {
            throw new AppException(ResponseCode.INVALID_ROLE, "invalid role " + role);
        }
        return external;
    }

    /**
     * 外部角色对象映射为本地角色，无法识别时返回 UNKNOWN。
     */
    public UserRoleEnum toLocal(ExternalRole role) {
        return role == null ? UserRoleEnum.UNKNOWN : toLocal(role.id());
    }

    /**
     * 外部角色 ID 映射为本地角色，无法识别时返回 UNKNOWN。
     */
    public UserRoleEnum toLocal(String externalRoleId) {
        if (externalRoleId == null) {
            return UserRoleEnum.UNKNOWN;
        }
        return externalIdToLocal.getOrDefault(externalRoleId, UserRoleEnum.UNKNOWN);
    }
}
