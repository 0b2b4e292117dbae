package com.taskadmin.domain.identity.model.entity;

import com.taskadmin.types.enums.UserRoleEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 身份提供方托管的用户实体。
 * <p>
 * 字段为 null 表示"未设置"，更新时不会清空外部对应字段。
 * </p>
 *
 * @author taskadmin
 * @since 2025-03-02
 */
@Data
public class IdentityUserEntity {

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

    /**
     * 角色列表，仅在完整读取（含角色翻页）后填充
     */
    private List<UserRoleEnum> roles;

    public boolean hasRole(UserRoleEnum role) {
        return roles != null && role != null && roles.contains(role);
    }
}
