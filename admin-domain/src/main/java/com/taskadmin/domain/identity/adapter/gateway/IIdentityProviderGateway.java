package com.taskadmin.domain.identity.adapter.gateway;

import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.domain.identity.model.valobj.ProviderPage;

import java.util.List;

/**
 * 外部身份提供方端口：用户管理与角色管理。
 * <p>
 * 调用失败时抛出 {@code AppException(IDENTITY_PROVIDER_ERROR)}，用户不存在时抛出
 * {@code AppException(NOT_FOUND)}。不做任何重试。
 * </p>
 */
public interface IIdentityProviderGateway {

    /**
     * 分页查询用户（page 从 0 开始）
     */
    ProviderPage<IdentityUserEntity> listUsers(int page, int perPage);

    /**
     * 读取用户资料（不含角色）
     */
    IdentityUserEntity getUser(String userId);

    /**
     * 以补丁方式更新用户资料，仅发送非空字段
     */
    void updateUser(String userId, IdentityUserEntity patch);

    /**
     * 删除用户
     */
    void deleteUser(String userId);

    /**
     * 分页查询用户角色（page 从 0 开始）
     */
    ProviderPage<ExternalRole> listUserRoles(String userId, int page, int perPage);

    /**
     * 为用户分配角色
     */
    void assignRoles(String userId, List<String> roleIds);

    /**
     * 回收用户角色
     */
    void removeRoles(String userId, List<String> roleIds);
}
