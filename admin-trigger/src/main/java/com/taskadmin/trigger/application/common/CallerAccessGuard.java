package com.taskadmin.trigger.application.common;

import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.service.UserIdentityDomainService;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.UserRoleEnum;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 调用方身份与权限判定：主体来自请求域声明，管理员身份以身份提供方中的角色为准。
 */
@Slf4j
@Component
public class CallerAccessGuard {

    private final UserIdentityDomainService userIdentityDomainService;

    public CallerAccessGuard(UserIdentityDomainService userIdentityDomainService) {
        this.userIdentityDomainService = userIdentityDomainService;
    }

    public String requireSubject(Object claimsAttribute) {
        return userIdentityDomainService.resolveSubject(claimsAttribute);
    }

    public IdentityUserEntity requireAdmin(Object claimsAttribute) {
        IdentityUserEntity caller = userIdentityDomainService.getUserFromContext(claimsAttribute);
        if (!caller.hasRole(UserRoleEnum.ADMIN)) {
            log.warn("Admin access denied. userId={}, roles={}", caller.getId(), caller.getRoles());
            throw new AppException(ResponseCode.FORBIDDEN, ResponseCode.FORBIDDEN.getInfo());
        }
        return caller;
    }
}
