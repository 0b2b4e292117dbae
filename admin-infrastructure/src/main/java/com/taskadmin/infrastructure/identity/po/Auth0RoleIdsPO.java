package com.taskadmin.infrastructure.identity.po;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 角色分配 / 回收请求体：{@code {"roles": ["rol_..."]}}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Auth0RoleIdsPO {

    private List<String> roles;
}
