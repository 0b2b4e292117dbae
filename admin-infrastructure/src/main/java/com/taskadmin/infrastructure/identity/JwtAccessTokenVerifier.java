package com.taskadmin.infrastructure.identity;

import com.taskadmin.domain.identity.adapter.gateway.IAccessTokenVerifier;
import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;

import java.util.Collections;

/**
 * 基于 Spring Security {@link JwtDecoder} 的访问令牌校验器。
 * <p>
 * 签名（JWKS）、签发方、受众、有效期的校验都由注入的解码器完成。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
public class JwtAccessTokenVerifier implements IAccessTokenVerifier {

    private final JwtDecoder jwtDecoder;

    public JwtAccessTokenVerifier(JwtDecoder jwtDecoder) {
        this.jwtDecoder = jwtDecoder;
    }

    @Override
    public ValidatedClaims verify(String token) {
        if (StringUtils.isBlank(token)) {
            throw new AppException(ResponseCode.INVALID_CLAIMS, "Access token is empty");
        }
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException ex) {
            log.warn("Access token rejected. error={}", ex.getMessage());
            throw new AppException(ResponseCode.INVALID_CLAIMS, "Access token rejected", ex);
        }
        if (StringUtils.isBlank(jwt.getSubject())) {
            throw new AppException(ResponseCode.INVALID_CLAIMS, "Access token has no subject");
        }
        return new ValidatedClaims(
                jwt.getSubject(),
                jwt.getIssuer() == null ? null : jwt.getIssuer().toString(),
                jwt.getAudience() == null ? Collections.emptyList() : jwt.getAudience(),
                jwt.getExpiresAt(),
                jwt.getClaims());
    }
}
