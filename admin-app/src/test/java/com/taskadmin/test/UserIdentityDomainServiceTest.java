package com.taskadmin.test;

import com.taskadmin.domain.identity.adapter.gateway.IIdentityProviderGateway;
import com.taskadmin.domain.identity.model.entity.IdentityUserEntity;
import com.taskadmin.domain.identity.model.valobj.ExternalRole;
import com.taskadmin.domain.identity.model.valobj.ProviderPage;
import com.taskadmin.domain.identity.model.valobj.UserPageResult;
import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;
import com.taskadmin.domain.identity.service.UserIdentityDomainService;
import com.taskadmin.domain.identity.service.UserRoleMapper;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.enums.UserRoleEnum;
import com.taskadmin.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class UserIdentityDomainServiceTest {

    private static final ExternalRole USER = new ExternalRole("rol_wgtsNMZVvH6xhrnu", "User");
    private static final ExternalRole MEMBER = new ExternalRole("rol_ojPUsNcwlWeofPmS", "Member");
    private static final ExternalRole ADMIN = new ExternalRole("rol_9wVRSPWcCNB3AypM", "Admin");

    private final IIdentityProviderGateway gateway = mock(IIdentityProviderGateway.class);
    private final UserIdentityDomainService service =
            new UserIdentityDomainService(gateway, UserRoleMapper.of(USER, MEMBER, ADMIN));

    @Test
    public void shouldRejectMissingAuthContext() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.getUserFromContext(null));

        Assertions.assertTrue(ex.is(ResponseCode.NO_AUTH_CONTEXT));
        verifyNoInteractions(gateway);
    }

    @Test
    public void shouldRejectMalformedClaims() {
        AppException wrongType = Assertions.assertThrows(AppException.class,
                () -> service.getUserFromContext(Map.of("sub", "auth0|1")));
        AppException blankSubject = Assertions.assertThrows(AppException.class,
                () -> service.getUserFromContext(claims(" ")));

        Assertions.assertTrue(wrongType.is(ResponseCode.INVALID_CLAIMS));
        Assertions.assertTrue(blankSubject.is(ResponseCode.INVALID_CLAIMS));
        verifyNoInteractions(gateway);
    }

    @Test
    public void shouldResolveUserFromClaimsWithRoles() {
        when(gateway.getUser("auth0|1")).thenReturn(user("auth0|1"));
        when(gateway.listUserRoles("auth0|1", 0, 100)).thenReturn(new ProviderPage<>(List.of(ADMIN), 0, 1, 1));

        IdentityUserEntity user = service.getUserFromContext(claims("auth0|1"));

        Assertions.assertEquals("auth0|1", user.getId());
        Assertions.assertEquals(List.of(UserRoleEnum.ADMIN), user.getRoles());
        Assertions.assertTrue(user.hasRole(UserRoleEnum.ADMIN));
    }

    @Test
    public void shouldReturnNotFoundWhenProviderHasNoUser() {
        when(gateway.getUser("auth0|ghost")).thenReturn(null);

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.getUser("auth0|ghost"));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldReturnSinglePageWithProviderTotal() {
        when(gateway.listUsers(2, 10)).thenReturn(new ProviderPage<>(List.of(user("a"), user("b")), 20, 2, 22));

        UserPageResult result = service.listUsers(2, 10);

        Assertions.assertEquals(2, result.users().size());
        Assertions.assertEquals(22L, result.total());
    }

    @Test
    public void shouldRejectInvalidUserPagingWithoutProviderCall() {
        AppException negativePage = Assertions.assertThrows(AppException.class, () -> service.listUsers(-1, 10));
        AppException zeroSize = Assertions.assertThrows(AppException.class, () -> service.listUsers(0, 0));

        Assertions.assertTrue(negativePage.is(ResponseCode.ILLEGAL_PARAMETER));
        Assertions.assertTrue(zeroSize.is(ResponseCode.ILLEGAL_PARAMETER));
        verifyNoInteractions(gateway);
    }

    @Test
    public void shouldConcatenateAllPagesInProviderOrder() {
        when(gateway.listUsers(0, 100)).thenReturn(new ProviderPage<>(List.of(user("u1"), user("u2")), 0, 2, 3));
        when(gateway.listUsers(1, 100)).thenReturn(new ProviderPage<>(List.of(user("u3")), 2, 1, 3));

        List<IdentityUserEntity> users = service.listAllUsers();

        Assertions.assertEquals(List.of("u1", "u2", "u3"),
                users.stream().map(IdentityUserEntity::getId).collect(Collectors.toList()));
        verify(gateway, never()).listUsers(2, 100);
    }

    @Test
    public void shouldStopSweepOnEmptyPage() {
        when(gateway.listUsers(0, 100)).thenReturn(new ProviderPage<>(Collections.emptyList(), 0, 0, 5));

        Assertions.assertTrue(service.listAllUsers().isEmpty());
        verify(gateway, never()).listUsers(1, 100);
    }

    @Test
    public void shouldMapUnrecognizedRolesToUnknownAcrossPages() {
        when(gateway.listUserRoles("auth0|1", 0, 100))
                .thenReturn(new ProviderPage<>(List.of(MEMBER, new ExternalRole("rol_legacy", "Legacy")), 0, 2, 3));
        when(gateway.listUserRoles("auth0|1", 1, 100))
                .thenReturn(new ProviderPage<>(List.of(USER), 2, 1, 3));

        List<UserRoleEnum> roles = service.listUserRoles("auth0|1");

        Assertions.assertEquals(List.of(UserRoleEnum.MEMBER, UserRoleEnum.UNKNOWN, UserRoleEnum.USER), roles);
    }

    @Test
    public void shouldAssignAndRemoveByExternalRoleId() {
        service.assignUserRole("auth0|1", UserRoleEnum.MEMBER);
        service.removeUserRole("auth0|1", UserRoleEnum.ADMIN);

        verify(gateway).assignRoles("auth0|1", List.of(MEMBER.id()));
        verify(gateway).removeRoles("auth0|1", List.of(ADMIN.id()));
    }

    @Test
    public void shouldNotCallProviderForUnknownRole() {
        AppException assign = Assertions.assertThrows(AppException.class,
                () -> service.assignUserRole("auth0|1", UserRoleEnum.UNKNOWN));
        AppException remove = Assertions.assertThrows(AppException.class,
                () -> service.removeUserRole("auth0|1", null));

        Assertions.assertTrue(assign.is(ResponseCode.INVALID_ROLE));
        Assertions.assertTrue(remove.is(ResponseCode.INVALID_ROLE));
        verify(gateway, never()).assignRoles(anyString(), anyList());
        verify(gateway, never()).removeRoles(anyString(), anyList());
    }

    @Test
    public void shouldSendOnlyProvidedFieldsOnUpdate() {
        IdentityUserEntity patch = new IdentityUserEntity();
        patch.setId("auth0|1");
        patch.setNickname("neo");
        patch.setLocation("ignored");

        service.updateUser(patch);

        ArgumentCaptor<IdentityUserEntity> captor = ArgumentCaptor.forClass(IdentityUserEntity.class);
        verify(gateway).updateUser(eq("auth0|1"), captor.capture());
        Assertions.assertEquals("neo", captor.getValue().getNickname());
        Assertions.assertNull(captor.getValue().getEmail());
        Assertions.assertNull(captor.getValue().getName());
        Assertions.assertNull(captor.getValue().getLocation());
    }

    @Test
    public void shouldRequireUserIdOnUpdate() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> service.updateUser(new IdentityUserEntity()));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
        verify(gateway, never()).updateUser(anyString(), any());
    }

    @Test
    public void shouldPropagateProviderFailureUnwrapped() {
        when(gateway.listUsers(anyInt(), anyInt()))
                .thenThrow(new AppException(ResponseCode.IDENTITY_PROVIDER_ERROR, "timeout"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> service.listAllUsers());

        Assertions.assertTrue(ex.is(ResponseCode.IDENTITY_PROVIDER_ERROR));
    }

    private ValidatedClaims claims(String subject) {
        return new ValidatedClaims(subject, "https://tenant.eu.auth0.com/", List.of("https://task-admin/api"),
                Instant.now().plusSeconds(3600), Map.of("sub", subject));
    }

    private IdentityUserEntity user(String id) {
        IdentityUserEntity user = new IdentityUserEntity();
        user.setId(id);
        user.setEmail(id + "@example.com");
        return user;
    }
}
