package com.taskadmin.domain.identity.adapter.gateway;

import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;

/**
 * 访问令牌校验端口：签名、签发方、受众与有效期由实现方委托给成熟库完成。
 */
public interface IAccessTokenVerifier {

    /**
     * 校验令牌并返回声明。
     *
     * @param token 不带 Bearer 前缀的令牌
     * @return 已校验的声明
     * @throws com.taskadmin.types.exception.AppException INVALID_CLAIMS 校验失败时
     */
    ValidatedClaims verify(String token);
}
