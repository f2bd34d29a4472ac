package com.resumecontrol.repository;

import com.resumecontrol.model.entity.User;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for User entities. A user's id is the owner id of everything it tracks.
 */
@Repository
public interface UserRepository extends ReactiveCrudRepository<User, UUID> {

    /**
     * Check if email exists (case-insensitive).
     */
    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE LOWER(email) = LOWER(:email))")
    Mono<Boolean> existsByEmail(String email);

    /**
     * Check whether another user already holds {@code email}.
     */
    @Query("SELECT EXISTS(SELECT 1 FROM users WHERE LOWER(email) = LOWER(:email) AND id <> :id)")
    Mono<Boolean> existsByEmailAndIdNot(String email, UUID id);

    @Modifying
    @Query("UPDATE users SET name = :name, email = :email, updated_at = NOW() WHERE id = :id")
    Mono<Integer> updateProfile(UUID id, String name, String email);
}
