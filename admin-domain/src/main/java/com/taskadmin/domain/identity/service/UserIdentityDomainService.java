package com.taskadmin.domain.identity.service;

import com.taskadmin.domain.identity.adapter.gateway.IIdentityProviderGateway;
import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.domain.identity.model.valobj.ProviderPage;
import com.taskadmin.domain.identity.model.valobj.UserPageResult;
import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;
import com.taskadmin.types.common.Constants;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.UserRoleEnum;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;

/**
 * 身份网关领域服务：封装身份提供方的用户 / 角色管理与本地角色映射。
 * <p>
 * 全量拉取（{@link #listAllUsers()}、{@link #listUserRoles(String)}）按固定页大小顺序翻页，
 * 直到提供方报告没有下一页为止；内部没有迭代上限，调用方需要通过请求超时兜底。
 * </p>
 */
@Slf4j
@Service
public class UserIdentityDomainService {

    private final IIdentityProviderGateway identityProviderGateway;
    private final UserRoleMapper userRoleMapper;

    public UserIdentityDomainService(IIdentityProviderGateway identityProviderGateway,
                                     UserRoleMapper userRoleMapper) {
        this.identityProviderGateway = identityProviderGateway;
        this.userRoleMapper = userRoleMapper;
    }

    /**
     * 从请求域声明解析当前用户。
     *
     * @param claimsAttribute 请求域中的声明对象，可能为 null
     */
    public IdentityUserEntity getUserFromContext(Object claimsAttribute) {
        return getUser(resolveSubject(claimsAttribute));
    }

    /**
     * 从请求域声明解析主体 ID，不访问身份提供方。
     */
    public String resolveSubject(Object claimsAttribute) {
        if (claimsAttribute == null) {
            throw new AppException(ResponseCode.NO_AUTH_CONTEXT, ResponseCode.NO_AUTH_CONTEXT.getInfo());
        }
        if (!(claimsAttribute instanceof ValidatedClaims claims) || StringUtils.isBlank(claims.subject())) {
            log.warn("Invalid claims in request context. type={}", claimsAttribute.getClass().getName());
            throw new AppException(ResponseCode.INVALID_CLAIMS, ResponseCode.INVALID_CLAIMS.getInfo());
        }
        return claims.subject();
    }

    /**
     * 单页查询用户，不做本地聚合。page 从 0 开始，pageSize 至少为 1。
     */
    public UserPageResult listUsers(int page, int pageSize) {
        if (page < 0 || pageSize < 1) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER,
                    "page 不能小于 0 且 pageSize 必须大于 0, page=" + page + ", pageSize=" + pageSize);
        }
        ProviderPage<IdentityUserEntity> result = identityProviderGateway.listUsers(page, pageSize);
        List<IdentityUserEntity> users = result.items() == null ? Collections.emptyList() : result.items();
        return new UserPageResult(users, result.total());
    }

    /**
     * 全量拉取用户，结果保持提供方顺序。
     */
    public List<IdentityUserEntity> listAllUsers() {
        List<IdentityUserEntity> users = sweep(page -> identityProviderGateway.listUsers(page, Constants.IDENTITY_SWEEP_PAGE_SIZE));
        log.debug("Listed all users. count={}", users.size());
        return users;
    }

    /**
     * 读取用户资料并附加完整角色列表。
     */
    public IdentityUserEntity getUser(String userId) {
        String normalized = requireUserId(userId);
        IdentityUserEntity user = identityProviderGateway.getUser(normalized);
        if (user == null) {
            throw new AppException(ResponseCode.NOT_FOUND, "user not found: " + normalized);
        }
        user.setRoles(listUserRoles(normalized));
        return user;
    }

    /**
     * 更新用户资料，仅同步非空字段。
     */
    public void updateUser(IdentityUserEntity user) {
        if (user == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "user cannot be null");
        }
        String userId = requireUserId(user.getId());
        identityProviderGateway.updateUser(userId, toPatch(user));
    }

    public void deleteUser(String userId) {
        identityProviderGateway.deleteUser(requireUserId(userId));
    }

    /**
     * 全量拉取用户角色并映射为本地角色；无法识别的外部角色降级为 UNKNOWN。
     */
    public List<UserRoleEnum> listUserRoles(String userId) {
        String normalized = requireUserId(userId);
        List<ExternalRole> externalRoles = sweep(page ->
                identityProviderGateway.listUserRoles(normalized, page, Constants.IDENTITY_SWEEP_PAGE_SIZE));
        List<UserRoleEnum> roles = new ArrayList<>(externalRoles.size());
        for (ExternalRole externalRole : externalRoles) {
            UserRoleEnum role = userRoleMapper.toLocal(externalRole);
            if (role == UserRoleEnum.UNKNOWN) {
                log.warn("Unrecognized external role. userId={}, roleId={}", normalized,
                        externalRole == null ? null : externalRole.id());
            }
            roles.add(role);
        }
        return roles;
    }

    public void assignUserRole(String userId, UserRoleEnum role) {
        ExternalRole externalRole = userRoleMapper.toExternal(role);
        identityProviderGateway.assignRoles(requireUserId(userId), List.of(externalRole.id()));
        log.info("Assigned role. userId={}, role={}", userId, role);
    }

    public void removeUserRole(String userId, UserRoleEnum role) {
        ExternalRole externalRole = userRoleMapper.toExternal(role);
        identityProviderGateway.removeRoles(requireUserId(userId), List.of(externalRole.id()));
        log.info("Removed role. userId={}, role={}", userId, role);
    }

    private <T> List<T> sweep(IntFunction<ProviderPage<T>> pageLoader) {
        List<T> collected = new ArrayList<>();
        int page = 0;
        while (true) {
            ProviderPage<T> result = pageLoader.apply(page);
            if (result == null) {
                break;
            }
            if (result.items() != null) {
                collected.addAll(result.items());
            }
            if (!result.hasNext()) {
                break;
            }
            page++;
        }
        return collected;
    }

    private IdentityUserEntity toPatch(IdentityUserEntity user) {
        IdentityUserEntity patch = new IdentityUserEntity();
        if (user.getEmail() != null) {
            patch.setEmail(user.getEmail());
        }
        if (user.getName() != null) {
            patch.setName(user.getName());
        }
        if (user.getPicture() != null) {
            patch.setPicture(user.getPicture());
        }
        if (user.getGivenName() != null) {
            patch.setGivenName(user.getGivenName());
        }
        if (user.getFamilyName() != null) {
            patch.setFamilyName(user.getFamilyName());
        }
        if (user.getUsername() != null) {
            patch.setUsername(user.getUsername());
        }
        if (user.getNickname() != null) {
            patch.setNickname(user.getNickname());
        }
        return patch;
    }

    private String requireUserId(String userId) {
        String normalized = StringUtils.trimToNull(userId);
        if (normalized == null) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "userId 不能为空");
        }
        return normalized;
    }
}
