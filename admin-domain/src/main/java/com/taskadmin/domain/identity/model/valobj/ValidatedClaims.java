package com.taskadmin.domain.identity.model.valobj;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 已校验的访问令牌声明，由鉴权过滤器放入请求域。
 *
 * @param subject 主体 ID（身份提供方用户 ID）
 * @param issuer 签发方
 * @param audience 受众
 * @param expiresAt 过期时间
 * @param claims 原始声明
 */
public record ValidatedClaims(String subject,
                              String issuer,
                              List<String> audience,
                              Instant expiresAt,
                              Map<String, Object> claims) {
}
