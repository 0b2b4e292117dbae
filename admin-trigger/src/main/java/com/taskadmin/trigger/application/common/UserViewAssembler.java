package com.taskadmin.trigger.application.common;

import com.taskadmin.api.dto.UserDTO;
import com.taskadmin.api.dto.UserUpdateRequestDTO;
import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.types.enums.UserRoleEnum;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 用户视图组装器。
 */
@Component
public class UserViewAssembler {

    public UserDTO toUserDTO(IdentityUserEntity user) {
        if (user == null) {
            return null;
        }
        UserDTO dto = new UserDTO();
        dto.setId(user.getId());
        dto.setEmail(user.getEmail());
        dto.setName(user.getName());
        dto.setPicture(user.getPicture());
        dto.setGivenName(user.getGivenName());
        dto.setFamilyName(user.getFamilyName());
        dto.setUsername(user.getUsername());
        dto.setNickname(user.getNickname());
        dto.setScreenName(user.getScreenName());
        dto.setConnection(user.getConnection());
        dto.setLocation(user.getLocation());
        dto.setLastLogin(user.getLastLogin());
        dto.setRoles(toRoleCodes(user.getRoles()));
        return dto;
    }

    public List<String> toRoleCodes(List<UserRoleEnum> roles) {
        if (roles == null) {
            return Collections.emptyList();
        }
        return roles.stream().map(UserRoleEnum::getCode).collect(Collectors.toList());
    }

    public IdentityUserEntity toPatch(String userId, UserUpdateRequestDTO request) {
        IdentityUserEntity patch = new IdentityUserEntity();
        patch.setId(userId);
        if (request == null) {
            return patch;
        }
        patch.setEmail(request.getEmail());
        patch.setName(request.getName());
        patch.setPicture(request.getPicture());
        patch.setGivenName(request.getGivenName());
        patch.setFamilyName(request.getFamilyName());
        patch.setUsername(request.getUsername());
        patch.setNickname(request.getNickname());
        return patch;
    }
}
