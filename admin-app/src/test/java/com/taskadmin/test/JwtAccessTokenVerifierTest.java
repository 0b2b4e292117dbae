package com.taskadmin.test;

import com.taskadmin.domain.identity.model.valobj.ValidatedClaims;
import com.taskadmin.infrastructure.identity.JwtAccessTokenVerifier;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class JwtAccessTokenVerifierTest {

    private final JwtDecoder decoder = mock(JwtDecoder.class);
    private final JwtAccessTokenVerifier verifier = new JwtAccessTokenVerifier(decoder);

    @Test
    public void shouldExposeDecodedClaims() {
        Instant expiresAt = Instant.now().plusSeconds(600);
        Jwt jwt = Jwt.withTokenValue("good")
                .header("alg", "RS256")
                .subject("auth0|alice")
                .issuer("https://tenant.eu.auth0.com/")
                .audience(List.of("https://task-admin/api"))
                .issuedAt(Instant.now())
                .expiresAt(expiresAt)
                .build();
        when(decoder.decode("good")).thenReturn(jwt);

        ValidatedClaims claims = verifier.verify("good");

        Assertions.assertEquals("auth0|alice", claims.subject());
        Assertions.assertEquals("https://tenant.eu.auth0.com/", claims.issuer());
        Assertions.assertEquals(List.of("https://task-admin/api"), claims.audience());
        Assertions.assertEquals(expiresAt, claims.expiresAt());
    }

    @Test
    public void shouldRejectTokenRefusedByDecoder() {
        when(decoder.decode("expired")).thenThrow(new BadJwtException("Jwt expired"));

        AppException ex = Assertions.assertThrows(AppException.class, () -> verifier.verify("expired"));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_CLAIMS));
    }

    @Test
    public void shouldRejectBlankToken() {
        AppException ex = Assertions.assertThrows(AppException.class, () -> verifier.verify(" "));

        Assertions.assertTrue(ex.is(ResponseCode.INVALID_CLAIMS));
    }
}
