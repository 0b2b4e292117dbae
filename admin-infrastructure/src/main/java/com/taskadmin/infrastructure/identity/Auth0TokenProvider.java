package com.taskadmin.infrastructure.identity;

import com.taskadmin.infrastructure.identity.po.Auth0TokenPO;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auth0 Management API 访问令牌提供者（client credentials）。
 * <p>
 * 令牌缓存到过期前 {@link #EXPIRY_SKEW} 为止，之后重新换取。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
public class Auth0TokenProvider {

    static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);

    private final RestClient restClient;
    private final String clientId;
    private final String clientSecret;
    private final String audience;
    private final Clock clock;

    private String cachedToken;
    private Instant cachedUntil = Instant.EPOCH;

    public Auth0TokenProvider(RestClient restClient, String clientId, String clientSecret, String audience, Clock clock) {
        this.restClient = restClient;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.audience = audience;
        this.clock = clock;
    }

    public synchronized String getAccessToken() {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(cachedUntil)) {
            return cachedToken;
        }
        Auth0TokenPO token = requestToken();
        cachedToken = token.getAccessToken();
        cachedUntil = now.plusSeconds(token.getExpiresIn()).minus(EXPIRY_SKEW);
        log.info("Management token refreshed. audience={}, expiresIn={}s", audience, token.getExpiresIn());
        return cachedToken;
    }

    private Auth0TokenPO requestToken() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("grant_type", "client_credentials");
        body.put("client_id", clientId);
        body.put("client_secret", clientSecret);
        body.put("audience", audience);
        Auth0TokenPO token;
        try {
            token = restClient.post()
                    .uri("/oauth/token")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(Auth0TokenPO.class);
        } catch (RestClientException ex) {
            log.error("Management token request failed. audience={}, error={}", audience, ex.getMessage());
            throw new AppException(ResponseCode.IDENTITY_PROVIDER_ERROR, "Failed to obtain management token", ex);
        }
        if (token == null || StringUtils.isBlank(token.getAccessToken())) {
            throw new AppException(ResponseCode.IDENTITY_PROVIDER_ERROR, "Management token response is empty");
        }
        return token;
    }
}
