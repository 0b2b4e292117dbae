package com.taskadmin.config;

import com.taskadmin.domain.identity.adapter.gateway.IAccessTokenVerifier;
import com.taskadmin.domain.identity.adapter.gateway.IIdentityProviderGateway;
import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.domain.identity.service.UserRoleMapper;
import com.taskadmin.infrastructure.identity.Auth0ManagementGateway;
import com.taskadmin.infrastructure.identity.Auth0TokenProvider;
import com.taskadmin.infrastructure.identity.JwtAccessTokenVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;

/**
 * 身份提供方配置类：角色映射、Management API 客户端与访问令牌校验器。
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
@Configuration
public class IdentityProviderConfig {

    @Bean
    public UserRoleMapper userRoleMapper(IdentityProviderProperties properties) {
        IdentityProviderProperties.Roles roles = properties.getRoles();
        return UserRoleMapper.of(
                new ExternalRole(roles.getUser().getId(), roles.getUser().getName()),
                new ExternalRole(roles.getMember().getId(), roles.getMember().getName()),
                new ExternalRole(roles.getAdmin().getId(), roles.getAdmin().getName()));
    }

    @Bean
    public Auth0TokenProvider auth0TokenProvider(IdentityProviderProperties properties) {
        RestClient restClient = RestClient.builder()
                .baseUrl("https://" + properties.getDomain())
                .requestFactory(requestFactory(properties))
                .build();
        return new Auth0TokenProvider(restClient,
                properties.getClientId(),
                properties.getClientSecret(),
                properties.resolveManagementAudience(),
                Clock.systemUTC());
    }

    @Bean
    public IIdentityProviderGateway identityProviderGateway(IdentityProviderProperties properties,
                                                            Auth0TokenProvider auth0TokenProvider) {
        RestClient restClient = RestClient.builder()
                .baseUrl("https://" + properties.getDomain() + "/api/v2")
                .requestFactory(requestFactory(properties))
                .build();
        log.info("Identity provider gateway: auth0. domain={}", properties.getDomain());
        return new Auth0ManagementGateway(restClient, auth0TokenProvider);
    }

    @Bean
    public IAccessTokenVerifier accessTokenVerifier(IdentityProviderProperties properties) {
        String issuer = properties.issuer();
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(issuer + ".well-known/jwks.json").build();
        OAuth2TokenValidator<Jwt> audienceValidator = new JwtClaimValidator<List<String>>(JwtClaimNames.AUD,
                audience -> audience != null && audience.contains(properties.getApiAudience()));
        decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
                JwtValidators.createDefaultWithIssuer(issuer), audienceValidator));
        return new JwtAccessTokenVerifier(decoder);
    }

    private SimpleClientHttpRequestFactory requestFactory(IdentityProviderProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getReadTimeout().toMillis());
        return factory;
    }
}
