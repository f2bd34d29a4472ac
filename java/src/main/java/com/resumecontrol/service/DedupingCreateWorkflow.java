package com.resumecontrol.service;

import com.resumecontrol.exception.DuplicateResourceException;
import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.exception.StoreException;
import com.resumecontrol.model.entity.Company;
import com.resumecontrol.repository.CompanyRepository;
import com.resumecontrol.util.Fields;
import com.resumecontrol.util.NameNormalizer;
import com.resumecontrol.util.NormalizedName;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Get-or-create and rename for companies, whose names are unique per owner.
 *
 * Uniqueness is decided by the store's {@code (owner_id, name_key)} constraint.
 * The lookup before the insert only avoids needless writes; when two callers
 * race past it, the loser's insert fails on the constraint and it returns the
 * winner's row. No locks are taken.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DedupingCreateWorkflow {

    private static final String RESOURCE = "Company";

    private final CompanyRepository companyRepository;

    /**
     * Return the owner's company with an equivalent name, creating it if there is none.
     *
     * @param ownerId Owner ID
     * @param rawName Name as typed by the user
     * @param website Optional website
     * @return the company, flagged {@code existed} when no row was inserted
     */
    public Mono<CreateOutcome<Company>> getOrCreate(UUID ownerId, String rawName, String website) {
        NormalizedName name = NameNormalizer.normalize(rawName);
        if (name.isEmpty()) {
            return Mono.error(new InvalidArgumentException("name", "Company name is required"));
        }
        String normalizedWebsite = Fields.optionalText(website);

        return findExisting(ownerId, name)
                .switchIfEmpty(Mono.defer(() -> insert(ownerId, name, normalizedWebsite)))
                .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("create company", e));
    }

    /**
     * Rename a company. Fails with {@link DuplicateResourceException} naming the
     * other company when the new name collides with it; the row is left unchanged.
     */
    public Mono<Company> rename(UUID ownerId, Long id, String rawName, String website) {
        NormalizedName name = NameNormalizer.normalize(rawName);
        if (name.isEmpty()) {
            return Mono.error(new InvalidArgumentException("name", "Company name is required"));
        }
        String normalizedWebsite = Fields.optionalText(website);

        return OwnedRows.required(companyRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .flatMap(current -> companyRepository.findByOwnerIdAndNameKey(ownerId, name.getKey())
                        .filter(other -> !other.getId().equals(current.getId()))
                        .flatMap(other -> Mono.<Integer>error(collision(other)))
                        .switchIfEmpty(Mono.defer(() -> companyRepository.updateByIdAndOwnerId(
                                id, ownerId, name.getDisplay(), name.getKey(), normalizedWebsite))))
                .onErrorResume(StoreErrors::isUniqueViolation, e -> companyRepository
                        .findByOwnerIdAndNameKey(ownerId, name.getKey())
                        .flatMap(other -> Mono.<Integer>error(collision(other)))
                        .switchIfEmpty(Mono.error(new StoreException("Company name conflict could not be resolved", e))))
                .flatMap(rows -> rows > 0
                        ? OwnedRows.required(companyRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                        : Mono.<Company>error(new ResourceNotFoundException(RESOURCE, id)))
                .doOnNext(updated -> log.info("Renamed company {} to '{}' for owner {}", id, updated.getName(), ownerId))
                .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("update company", e));
    }

    private Mono<CreateOutcome<Company>> findExisting(UUID ownerId, NormalizedName name) {
        return companyRepository.findByOwnerIdAndNameKey(ownerId, name.getKey())
                .map(CreateOutcome::existing);
    }

    private Mono<CreateOutcome<Company>> insert(UUID ownerId, NormalizedName name, String website) {
        LocalDateTime now = LocalDateTime.now();
        Company company = Company.builder()
                .ownerId(ownerId)
                .name(name.getDisplay())
                .nameKey(name.getKey())
                .website(website)
                .createdAt(now)
                .updatedAt(now)
                .build();

        return companyRepository.save(company)
                .map(saved -> {
                    log.info("Created company {} '{}' for owner {}", saved.getId(), saved.getName(), ownerId);
                    return CreateOutcome.created(saved);
                })
                .onErrorResume(StoreErrors::isUniqueViolation, e -> {
                    log.info("Company '{}' was created concurrently for owner {}, returning existing row",
                            name.getDisplay(), ownerId);
                    return findExisting(ownerId, name)
                            .switchIfEmpty(Mono.error(new StoreException("Company name conflict could not be resolved", e)));
                });
    }

    private static DuplicateResourceException collision(Company other) {
        return new DuplicateResourceException(RESOURCE, other.getName(), other.getId());
    }
}
