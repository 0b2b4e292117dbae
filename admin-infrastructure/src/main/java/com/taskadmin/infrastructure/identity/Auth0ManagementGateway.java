package com.taskadmin.infrastructure.identity;

import com.taskadmin.domain.identity.adapter.gateway.IIdentityProviderGateway;
import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.domain.identity.model.valobj.ProviderPage;
import com.taskadmin.infrastructure.identity.po.Auth0RoleIdsPO;
import com.taskadmin.infrastructure.identity.po.Auth0RolesPagePO;
import com.taskadmin.infrastructure.identity.po.Auth0UserPO;
import com.taskadmin.infrastructure.identity.po.Auth0UsersPagePO;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Auth0 Management API v2 网关实现。
 * <p>
 * restClient 的 baseUrl 为 {@code https://{domain}/api/v2}。所有异常统一转换为
 * IDENTITY_PROVIDER_ERROR，404 转换为 NOT_FOUND，不做重试。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Slf4j
public class Auth0ManagementGateway implements IIdentityProviderGateway {

    private final RestClient restClient;
    private final Auth0TokenProvider tokenProvider;

    public Auth0ManagementGateway(RestClient restClient, Auth0TokenProvider tokenProvider) {
        this.restClient = restClient;
        this.tokenProvider = tokenProvider;
    }

    @Override
    public ProviderPage<IdentityUserEntity> listUsers(int page, int perPage) {
        Auth0UsersPagePO body = call("listUsers", null, () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/users")
                        .queryParam("page", page)
                        .queryParam("per_page", perPage)
                        .queryParam("include_totals", true)
                        .build())
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(Auth0UsersPagePO.class));
        if (body == null) {
            return new ProviderPage<>(Collections.emptyList(), 0, 0, 0);
        }
        List<IdentityUserEntity> users = body.getUsers() == null ? Collections.emptyList()
                : body.getUsers().stream().map(this::toEntity).collect(Collectors.toList());
        return new ProviderPage<>(users, body.getStart(), body.getLength(), body.getTotal());
    }

    @Override
    public IdentityUserEntity getUser(String userId) {
        Auth0UserPO body = call("getUser", userId, () -> restClient.get()
                .uri("/users/{id}", userId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(Auth0UserPO.class));
        return toEntity(body);
    }

    @Override
    public void updateUser(String userId, IdentityUserEntity patch) {
        Auth0UserPO body = toPatch(patch);
        call("updateUser", userId, () -> restClient.patch()
                .uri("/users/{id}", userId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void deleteUser(String userId) {
        call("deleteUser", userId, () -> restClient.delete()
                .uri("/users/{id}", userId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public ProviderPage<ExternalRole> listUserRoles(String userId, int page, int perPage) {
        Auth0RolesPagePO body = call("listUserRoles", userId, () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/users/{id}/roles")
                        .queryParam("page", page)
                        .queryParam("per_page", perPage)
                        .queryParam("include_totals", true)
                        .build(userId))
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(Auth0RolesPagePO.class));
        if (body == null) {
            return new ProviderPage<>(Collections.emptyList(), 0, 0, 0);
        }
        List<ExternalRole> roles = body.getRoles() == null ? Collections.emptyList()
                : body.getRoles().stream()
                .map(role -> new ExternalRole(role.getId(), role.getName()))
                .collect(Collectors.toList());
        return new ProviderPage<>(roles, body.getStart(), body.getLength(), body.getTotal());
    }

    @Override
    public void assignRoles(String userId, List<String> roleIds) {
        call("assignRoles", userId, () -> restClient.post()
                .uri("/users/{id}/roles", userId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new Auth0RoleIdsPO(roleIds))
                .retrieve()
                .toBodilessEntity());
    }

    @Override
    public void removeRoles(String userId, List<String> roleIds) {
        call("removeRoles", userId, () -> restClient.method(HttpMethod.DELETE)
                .uri("/users/{id}/roles", userId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .body(new Auth0RoleIdsPO(roleIds))
                .retrieve()
                .toBodilessEntity());
    }

    private String bearer() {
        return "Bearer " + tokenProvider.getAccessToken();
    }

    private <T> T call(String action, String userId, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException ex) {
            if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.warn("Identity provider resource not found. action={}, userId={}", action, userId);
                throw new AppException(ResponseCode.NOT_FOUND, "User not found: " + userId, ex);
            }
            log.error("Identity provider call failed. action={}, userId={}, status={}, error={}",
                    action, userId, ex.getStatusCode().value(), ex.getMessage());
            throw new AppException(ResponseCode.IDENTITY_PROVIDER_ERROR,
                    "Identity provider " + action + " failed with status " + ex.getStatusCode().value(), ex);
        } catch (RestClientException ex) {
            log.error("Identity provider call failed. action={}, userId={}, error={}", action, userId, ex.getMessage());
            throw new AppException(ResponseCode.IDENTITY_PROVIDER_ERROR, "Identity provider " + action + " failed", ex);
        }
    }

    private IdentityUserEntity toEntity(Auth0UserPO po) {
        if (po == null) {
            return null;
        }
        IdentityUserEntity entity = new IdentityUserEntity();
        entity.setId(po.getUserId());
        entity.setEmail(po.getEmail());
        entity.setName(po.getName());
        entity.setPicture(po.getPicture());
        entity.setGivenName(po.getGivenName());
        entity.setFamilyName(po.getFamilyName());
        entity.setUsername(po.getUsername());
        entity.setNickname(po.getNickname());
        entity.setScreenName(po.getScreenName());
        entity.setConnection(po.getConnection());
        entity.setLocation(po.getLocation());
        entity.setLastLogin(parseTime(po.getLastLogin()));
        return entity;
    }

    private Auth0UserPO toPatch(IdentityUserEntity patch) {
        Auth0UserPO po = new Auth0UserPO();
        po.setEmail(patch.getEmail());
        po.setName(patch.getName());
        po.setPicture(patch.getPicture());
        po.setGivenName(patch.getGivenName());
        po.setFamilyName(patch.getFamilyName());
        po.setUsername(patch.getUsername());
        po.setNickname(patch.getNickname());
        return po;
    }

    private LocalDateTime parseTime(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).atZoneSameInstant(ZoneId.systemDefault()).toLocalDateTime();
        } catch (DateTimeParseException ex) {
            log.warn("Unparseable last_login value. value={}", value);
            return null;
        }
    }
}
