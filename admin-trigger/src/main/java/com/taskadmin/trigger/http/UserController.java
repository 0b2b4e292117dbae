package com.taskadmin.trigger.http;

import com.taskadmin.api.dto.UserDTO;
import com.taskadmin.api.dto.UserPageDTO;
import com.taskadmin.api.dto.UserUpdateRequestDTO;
import com.taskadmin.api.response.Response;
import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.model.valobj.UserPageResult;
import com.taskadmin.domain.identity.service.UserIdentityDomainService;
import com.taskadmin.trigger.application.common.CallerAccessGuard;
import com.taskadmin.trigger.application.common.UserViewAssembler;
import com.taskadmin.types.common.Constants;
import com.taskadmin.types.enums.UserRoleEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 用户与角色管理 API。除 {@code /api/me} 外均要求调用方持有 Admin 角色。
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class UserController {

    private final UserIdentityDomainService userIdentityDomainService;
    private final UserViewAssembler userViewAssembler;
    private final CallerAccessGuard callerAccessGuard;

    public UserController(UserIdentityDomainService userIdentityDomainService,
                          UserViewAssembler userViewAssembler,
                          CallerAccessGuard callerAccessGuard) {
        this.userIdentityDomainService = userIdentityDomainService;
        this.userViewAssembler = userViewAssembler;
        this.callerAccessGuard = callerAccessGuard;
    }

    @GetMapping("/me")
    public Response<UserDTO> me(
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        return Response.success(userViewAssembler.toUserDTO(userIdentityDomainService.getUserFromContext(claims)));
    }

    /**
     * 单页查询，page 从 0 开始。
     */
    @GetMapping("/users")
    public Response<UserPageDTO> listUsers(
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "pageSize", defaultValue = "50") int pageSize,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        UserPageResult result = userIdentityDomainService.listUsers(page, pageSize);
        UserPageDTO dto = new UserPageDTO();
        dto.setUsers(toUserDTOs(result.users()));
        dto.setTotal(result.total());
        dto.setPage(page);
        dto.setPageSize(pageSize);
        return Response.success(dto);
    }

    @GetMapping("/users/all")
    public Response<List<UserDTO>> listAllUsers(
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        return Response.success(toUserDTOs(userIdentityDomainService.listAllUsers()));
    }

    @GetMapping("/users/{id}")
    public Response<UserDTO> getUser(
            @PathVariable("id") String userId,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        return Response.success(userViewAssembler.toUserDTO(userIdentityDomainService.getUser(userId)));
    }

    @PatchMapping("/users/{id}")
    public Response<UserDTO> updateUser(
            @PathVariable("id") String userId,
            @RequestBody UserUpdateRequestDTO request,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        IdentityUserEntity caller = callerAccessGuard.requireAdmin(claims);
        userIdentityDomainService.updateUser(userViewAssembler.toPatch(userId, request));
        log.info("User updated. userId={}, operator={}", userId, caller.getId());
        return Response.success(userViewAssembler.toUserDTO(userIdentityDomainService.getUser(userId)));
    }

    @DeleteMapping("/users/{id}")
    public Response<Void> deleteUser(
            @PathVariable("id") String userId,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        IdentityUserEntity caller = callerAccessGuard.requireAdmin(claims);
        userIdentityDomainService.deleteUser(userId);
        log.info("User deleted. userId={}, operator={}", userId, caller.getId());
        return Response.success(null);
    }

    @GetMapping("/users/{id}/roles")
    public Response<List<String>> listUserRoles(
            @PathVariable("id") String userId,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        return Response.success(userViewAssembler.toRoleCodes(userIdentityDomainService.listUserRoles(userId)));
    }

    @PostMapping("/users/{id}/roles/{role}")
    public Response<Void> assignUserRole(
            @PathVariable("id") String userId,
            @PathVariable("role") String role,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        userIdentityDomainService.assignUserRole(userId, UserRoleEnum.parse(role));
        return Response.success(null);
    }

    @DeleteMapping("/users/{id}/roles/{role}")
    public Response<Void> removeUserRole(
            @PathVariable("id") String userId,
            @PathVariable("role") String role,
            @RequestAttribute(value = Constants.REQ_ATTR_AUTH_CLAIMS, required = false) Object claims) {
        callerAccessGuard.requireAdmin(claims);
        userIdentityDomainService.removeUserRole(userId, UserRoleEnum.parse(role));
        return Response.success(null);
    }

    private List<UserDTO> toUserDTOs(List<IdentityUserEntity> users) {
        return users.stream().map(userViewAssembler::toUserDTO).collect(Collectors.toList());
    }
}
