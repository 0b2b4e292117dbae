package com.taskadmin.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户 DTO（身份提供方托管，不在本地持久化）。
 */
@Data
public class UserDTO {

    private String id;
    private String email;
    private String name;
    private String picture;
    private String givenName;
    private String familyName;
    private String username;
    private String nickname;
    private String screenName;
    private String connection;
    private String location;
    private LocalDateTime lastLogin;
    private List<String> roles;
}
