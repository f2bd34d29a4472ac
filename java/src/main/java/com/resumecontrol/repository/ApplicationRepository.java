package com.resumecontrol.repository;

import com.resumecontrol.model.entity.Application;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.UUID;

/**
 * Repository for Application entities.
 *
 * Pages are ordered newest applied date first, ties broken by id.
 */
@Repository
public interface ApplicationRepository extends ReactiveCrudRepository<Application, Long> {

    Mono<Application> findByIdAndOwnerId(Long id, UUID ownerId);

    Mono<Long> countByOwnerId(UUID ownerId);

    Mono<Long> countByOwnerIdAndStatus(UUID ownerId, String status);

    @Query("SELECT * FROM applications WHERE owner_id = :ownerId "
            + "ORDER BY applied_date DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Application> findPageByOwnerId(UUID ownerId, int limit, long offset);

    @Query("SELECT * FROM applications WHERE owner_id = :ownerId AND status = :status "
            + "ORDER BY applied_date DESC, id DESC LIMIT :limit OFFSET :offset")
    Flux<Application> findPageByOwnerIdAndStatus(UUID ownerId, String status, int limit, long offset);

    @Modifying
    @Query("UPDATE applications SET status = :status, applied_date = :appliedDate, contact_id = :contactId, "
            + "notes = :notes, updated_at = NOW() WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> updateByIdAndOwnerId(Long id, UUID ownerId, String status, LocalDate appliedDate,
                                       Long contactId, String notes);

    @Modifying
    @Query("DELETE FROM applications WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> deleteByIdAndOwnerId(Long id, UUID ownerId);
}
