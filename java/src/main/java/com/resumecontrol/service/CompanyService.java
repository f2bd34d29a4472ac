package com.resumecontrol.service;

import com.resumecontrol.model.dto.CompanyRequest;
import com.resumecontrol.model.dto.CompanyResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.model.entity.Company;
import com.resumecontrol.repository.CompanyRepository;
import com.resumecontrol.util.PageBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Service for company management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompanyService implements OwnedResourceService<CompanyResponse, CompanyRequest> {

    private static final String RESOURCE = "Company";

    private final CompanyRepository companyRepository;
    private final DedupingCreateWorkflow dedupingCreateWorkflow;

    @Override
    public Mono<PageResponse<CompanyResponse>> list(UUID ownerId, PageBounds bounds) {
        return OwnedRows.page(RESOURCE, bounds,
                companyRepository.countByOwnerId(ownerId),
                () -> companyRepository.findPageByOwnerId(ownerId, bounds.getLimit(), bounds.getOffset())
                        .map(this::toResponse));
    }

    @Override
    public Mono<CompanyResponse> get(UUID ownerId, Long id) {
        return OwnedRows.required(companyRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .map(this::toResponse);
    }

    /**
     * Get-or-create by name.
     *
     * @param ownerId Owner ID
     * @param request Company request
     * @return the company, flagged when it already existed
     */
    public Mono<CreateOutcome<CompanyResponse>> create(UUID ownerId, CompanyRequest request) {
        return dedupingCreateWorkflow.getOrCreate(ownerId, request.getName(), request.getWebsite())
                .map(outcome -> outcome.map(this::toResponse));
    }

    @Override
    public Mono<CompanyResponse> update(UUID ownerId, Long id, CompanyRequest request) {
        return dedupingCreateWorkflow.rename(ownerId, id, request.getName(), request.getWebsite())
                .map(this::toResponse);
    }

    /**
     * Delete a company. Fails with a conflict while jobs still reference it.
     */
    @Override
    public Mono<Void> delete(UUID ownerId, Long id) {
        return OwnedRows.deleted(companyRepository.deleteByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .doOnSuccess(ignored -> log.info("Deleted company {} for owner {}", id, ownerId));
    }

    /**
     * Convert entity to response DTO.
     */
    CompanyResponse toResponse(Company company) {
        return CompanyResponse.builder()
                .id(company.getId())
                .name(company.getName())
                .website(company.getWebsite())
                .createdAt(company.getCreatedAt())
                .updatedAt(company.getUpdatedAt())
                .build();
    }
}
