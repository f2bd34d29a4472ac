package com.resumecontrol.repository;

import com.resumecontrol.model.entity.Company;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Repository for Company entities.
 *
 * Every method except {@code save} of a new row takes the owner id and puts it
 * in the WHERE clause.
 */
@Repository
public interface CompanyRepository extends ReactiveCrudRepository<Company, Long> {

    Mono<Company> findByIdAndOwnerId(Long id, UUID ownerId);

    /**
     * Find a company by its comparison key within one owner.
     */
    Mono<Company> findByOwnerIdAndNameKey(UUID ownerId, String nameKey);

    Mono<Long> countByOwnerId(UUID ownerId);

    @Query("SELECT * FROM companies WHERE owner_id = :ownerId ORDER BY id ASC LIMIT :limit OFFSET :offset")
    Flux<Company> findPageByOwnerId(UUID ownerId, int limit, long offset);

    @Modifying
    @Query("UPDATE companies SET name = :name, name_key = :nameKey, website = :website, updated_at = NOW() "
            + "WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> updateByIdAndOwnerId(Long id, UUID ownerId, String name, String nameKey, String website);

    @Modifying
    @Query("DELETE FROM companies WHERE id = :id AND owner_id = :ownerId")
    Mono<Integer> deleteByIdAndOwnerId(Long id, UUID ownerId);
}
