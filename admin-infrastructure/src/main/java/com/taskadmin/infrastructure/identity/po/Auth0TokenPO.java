package com.taskadmin.infrastructure.identity.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * {@code POST /oauth/token} 响应体
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Auth0TokenPO {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("token_type")
    private String tokenType;

    @JsonProperty("expires_in")
    private long expiresIn;
}
