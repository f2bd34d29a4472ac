package com.resumecontrol.security;

import com.resumecontrol.exception.UnauthenticatedException;
import org.junit.jupiter.api.Test;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import reactor.test.StepVerifier;

import java.util.Collections;
import java.util.UUID;

/**
 * Unit tests for OwnershipGuard.
 */
class OwnershipGuardTest {

    private final OwnershipGuard ownershipGuard = new OwnershipGuard();

    @Test
    void authorize_ReturnsOwnerFromContext() {
        UUID ownerId = UUID.randomUUID();
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(ownerId, null, Collections.emptyList());

        StepVerifier.create(ownershipGuard.authorize()
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication)))
                .expectNext(ownerId)
                .verifyComplete();
    }

    @Test
    void authorize_AcceptsStringPrincipal() {
        UUID ownerId = UUID.randomUUID();
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(ownerId.toString(), null, Collections.emptyList());

        StepVerifier.create(ownershipGuard.authorize()
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication)))
                .expectNext(ownerId)
                .verifyComplete();
    }

    @Test
    void authorize_NoContextIsUnauthenticated() {
        StepVerifier.create(ownershipGuard.authorize())
                .expectError(UnauthenticatedException.class)
                .verify();
    }

    @Test
    void authorize_MalformedPrincipalIsUnauthenticated() {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken("not-a-uuid", null, Collections.emptyList());

        StepVerifier.create(ownershipGuard.authorize()
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication)))
                .expectError(UnauthenticatedException.class)
                .verify();
    }

    @Test
    void authorize_UnauthenticatedTokenIsRejected() {
        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(UUID.randomUUID(), null);

        StepVerifier.create(ownershipGuard.authorize()
                        .contextWrite(ReactiveSecurityContextHolder.withAuthentication(authentication)))
                .expectError(UnauthenticatedException.class)
                .verify();
    }
}
