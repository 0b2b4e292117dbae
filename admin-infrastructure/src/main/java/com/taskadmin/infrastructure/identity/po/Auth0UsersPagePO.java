package com.taskadmin.infrastructure.identity.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.List;

/**
 * {@code GET /api/v2/users?include_totals=true} 响应体
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Auth0UsersPagePO {

    private long start;

    private long limit;

    private long length;

    private long total;

    private List<Auth0UserPO> users;
}
