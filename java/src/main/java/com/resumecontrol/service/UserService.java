package com.resumecontrol.service;

import com.resumecontrol.exception.DuplicateResourceException;
import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.exception.UnauthenticatedException;
import com.resumecontrol.model.dto.UserRegisterRequest;
import com.resumecontrol.model.dto.UserRegisterResponse;
import com.resumecontrol.model.dto.UserResponse;
import com.resumecontrol.model.dto.UserUpdateRequest;
import com.resumecontrol.model.entity.User;
import com.resumecontrol.repository.ApiKeyRepository;
import com.resumecontrol.repository.UserRepository;
import com.resumecontrol.security.OwnerKeys;
import com.resumecontrol.util.Fields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * Users are the owners of all tracked data. This service registers them,
 * resolves bearer secrets to owner ids and maintains the caller's profile.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    private static final String RESOURCE = "User";

    private final UserRepository userRepository;
    private final ApiKeyRepository apiKeyRepository;

    /**
     * Register a new user and issue its first API key.
     *
     * @param request User registration request
     * @return Registration response carrying the only plaintext copy of the key
     */
    @Transactional
    public Mono<UserRegisterResponse> registerUser(UserRegisterRequest request) {
        return Mono.defer(() -> {
            String email = normalizeEmail(request.getEmail());
            String name = Fields.requireText(request.getName(), "name");
            return register(name, email);
        });
    }

    private Mono<UserRegisterResponse> register(String name, String email) {
        return userRepository.existsByEmail(email)
                .flatMap(exists -> {
                    if (exists) {
                        return Mono.error(new DuplicateResourceException(RESOURCE, email, null));
                    }

                    LocalDateTime now = LocalDateTime.now();
                    User user = User.builder()
                            .name(name)
                            .email(email)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();

                    return userRepository.save(user)
                            .flatMap(owner -> {
                                OwnerKeys.Issued issued = OwnerKeys.issue(owner.getId(), now);
                                return apiKeyRepository.save(issued.getKey())
                                        .map(saved -> {
                                            log.info("Registered user {} with key {}...", owner.getId(), saved.getHint());
                                            return UserRegisterResponse.builder()
                                                    .userId(owner.getId().toString())
                                                    .apiKey(issued.getSecret())
                                                    .message("User registered successfully. Save your API key securely!")
                                                    .build();
                                        });
                            });
                })
                .onErrorMap(StoreErrors::isUniqueViolation, e -> new DuplicateResourceException(RESOURCE, email, null));
    }

    /**
     * Resolve a bearer secret to the owner it was issued to, stamping the key as used.
     *
     * @param secret The presented API key
     * @return Owner UUID, or {@link UnauthenticatedException} when no key matches
     */
    public Mono<UUID> verifyApiKey(String secret) {
        if (!OwnerKeys.isWellFormed(secret)) {
            return Mono.error(new UnauthenticatedException("Invalid API key"));
        }
        return apiKeyRepository.touchOwnerByDigest(OwnerKeys.digest(secret))
                .switchIfEmpty(Mono.error(() -> new UnauthenticatedException("Invalid API key")));
    }

    public Mono<UserResponse> getCurrentUser(UUID ownerId) {
        return OwnedRows.required(userRepository.findById(ownerId), RESOURCE, ownerId)
                .map(this::toResponse);
    }

    /**
     * Change the caller's name and/or email. Blank fields keep their value; an
     * email held by another user is a conflict.
     */
    public Mono<UserResponse> updateCurrentUser(UUID ownerId, UserUpdateRequest request) {
        return Mono.defer(() -> {
            String name = Fields.optionalText(request.getName());
            String email = Fields.optionalText(request.getEmail()) == null
                    ? null
                    : normalizeEmail(request.getEmail());
            if (name == null && email == null) {
                return Mono.<UserResponse>error(
                        new InvalidArgumentException("name", "At least one of name or email is required"));
            }

            return OwnedRows.required(userRepository.findById(ownerId), RESOURCE, ownerId)
                    .flatMap(current -> verifyEmailFree(ownerId, email)
                            .then(OwnedRows.affected(Mono.defer(() -> userRepository.updateProfile(ownerId,
                                    name != null ? name : current.getName(),
                                    email != null ? email : current.getEmail())), RESOURCE, ownerId)))
                    .onErrorMap(StoreErrors::isUniqueViolation, e -> new DuplicateResourceException(RESOURCE, email, null))
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("update user", e))
                    .then(Mono.defer(() -> getCurrentUser(ownerId)))
                    .doOnNext(updated -> log.info("Updated profile of user {}", ownerId));
        });
    }

    private Mono<Void> verifyEmailFree(UUID ownerId, String email) {
        if (email == null) {
            return Mono.empty();
        }
        return userRepository.existsByEmailAndIdNot(email, ownerId)
                .flatMap(taken -> taken
                        ? Mono.<Void>error(new DuplicateResourceException(RESOURCE, email, null))
                        : Mono.<Void>empty());
    }

    private static String normalizeEmail(String email) {
        return Fields.requireText(email, "email").toLowerCase(Locale.ROOT);
    }

    UserResponse toResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .createdAt(user.getCreatedAt())
                .updatedAt(user.getUpdatedAt())
                .build();
    }
}
