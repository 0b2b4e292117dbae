package com.taskadmin.api.dto;

import lombok.Data;

/**
 * 用户资料更新请求 DTO。
 * <p>
 * 仅非空字段会被同步到身份提供方，未设置的字段保持原值。
 * </p>
 */
@Data
public class UserUpdateRequestDTO {

    private String email;
    private String name;
    private String picture;
    private String givenName;
    private String familyName;
    private String username;
    private String nickname;
}
