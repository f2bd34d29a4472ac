package com.resumecontrol.security;

import com.resumecontrol.exception.UnauthenticatedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Resolves the owner id of the current caller.
 *
 * Services take the returned id as a mandatory argument and put it into every
 * query predicate; rows of other owners are reported as not found.
 */
@Component
public class OwnershipGuard {

    /**
     * Owner id from the reactive security context.
     *
     * @return owner id, or {@link UnauthenticatedException} if absent or malformed
     */
    public Mono<UUID> authorize() {
        return ReactiveSecurityContextHolder.getContext()
                .flatMap(context -> Mono.justOrEmpty(context.getAuthentication()))
                .flatMap(authentication -> Mono.justOrEmpty(ownerIdOf(authentication)))
                .switchIfEmpty(Mono.error(new UnauthenticatedException("User not authenticated")));
    }

    /**
     * Owner id carried by an authentication, or {@code null} if there is none.
     */
    static UUID ownerIdOf(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            return null;
        }
        Object principal = authentication.getPrincipal();
        if (principal instanceof UUID) {
            return (UUID) principal;
        }
        if (principal instanceof String) {
            try {
                return UUID.fromString((String) principal);
            } catch (IllegalArgumentException e) {
                return null;
            }
        }
        return null;
    }
}
