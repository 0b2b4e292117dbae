package com.taskadmin.infrastructure.identity.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Auth0 Management API 用户对象，同时用作 PATCH 请求体（空字段不序列化）。
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Auth0UserPO {

    @JsonProperty("user_id")
    private String userId;

    private String email;

    private String name;

    private String picture;

    @JsonProperty("given_name")
    private String givenName;

    @JsonProperty("family_name")
    private String familyName;

    private String username;

    private String nickname;

    @JsonProperty("screen_name")
    private String screenName;

    private String connection;

    private String location;

    /**
     * ISO-8601 时间字符串
     */
    @JsonProperty("last_login")
    private String lastLogin;
}
