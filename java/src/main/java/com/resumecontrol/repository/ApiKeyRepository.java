package com.resumecontrol.repository;

import com.resumecontrol.model.entity.ApiKey;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Owner credentials, looked up by secret digest.
 */
@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKey, UUID> {

    /**
     * Mark the key with this digest as used and return the owner it was issued to.
     * Empty when no key matches.
     */
    @Query("UPDATE api_keys SET last_used_at = NOW() WHERE secret_digest = :secretDigest RETURNING owner_id")
    Mono<UUID> touchOwnerByDigest(String secretDigest);
}
