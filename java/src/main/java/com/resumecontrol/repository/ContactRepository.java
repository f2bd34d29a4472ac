package com.resumecontrol.repository;

import com.resumecontrol.model.entity.Contact;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Contact entities.
 */
@Repository
public interface ContactRepository extends ReactiveCrudRepository<Contact, Long> {

    Mono<Contact> findByIdAndOwnerId(Long id, UUID ownerId);

    Mono<Long> countByOwnerId(UUID ownerId);

    @Query("SELECT * FROM contacts WHERE owner_id = :ownerId ORDER BY id ASC LIMIT :limit OFFSET :offset")
    Flux<Contact> findPageByOwnerId(UUID ownerId, int limit, long offset);

    @Modifying
    @Query("UPDATE contacts SET name = :name, email = :email, phone = :phone, linkedin = :linkedin, "
            + "updated_at = NOW() WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> updateByIdAndOwnerId(Long id, UUID ownerId, String name, String email,
                                       String phone, String linkedin);

    @Modifying
    @Query("DELETE FROM contacts WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> deleteByIdAndOwnerId(Long id, UUID ownerId);
}
