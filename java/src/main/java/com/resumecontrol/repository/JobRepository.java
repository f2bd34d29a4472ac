package com.resumecontrol.repository;

import com.resumecontrol.model.entity.Job;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Job entities.
 *
 * Queries filter on the denormalized {@code owner_id} column instead of
 * joining through applications.
 */
@Repository
public interface JobRepository extends ReactiveCrudRepository<Job, Long> {

    Mono<Job> findByIdAndOwnerId(Long id, UUID ownerId);

    Mono<Job> findByApplicationIdAndOwnerId(Long applicationId, UUID ownerId);

    Mono<Long> countByOwnerId(UUID ownerId);

    @Query("SELECT * FROM jobs WHERE owner_id = :ownerId ORDER BY id ASC LIMIT :limit OFFSET :offset")
    Flux<Job> findPageByOwnerId(UUID ownerId, int limit, long offset);

    @Query("SELECT * FROM jobs WHERE company_id = :companyId AND owner_id = :ownerId ORDER BY id ASC")
    Flux<Job> findByCompanyIdAndOwnerId(Long companyId, UUID ownerId);

    @Modifying
    @Query("UPDATE jobs SET company_id = :companyId, title = :title, description = :description, "
            + "requirements = :requirements, location = :location, updated_at = NOW() "
            + "WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> updateByIdAndOwnerId(Long id, UUID ownerId, Long companyId, String title,
                                       String description, String requirements, String location);

    @Modifying
    @Query("DELETE FROM jobs WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> deleteByIdAndOwnerId(Long id, UUID ownerId);
}
