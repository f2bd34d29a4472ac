package com.resumecontrol.controller;

import com.resumecontrol.model.dto.CompanyRequest;
import com.resumecontrol.model.dto.CompanyResponse;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.CompanyService;
import com.resumecontrol.service.JobService;
import com.resumecontrol.util.PaginationPolicy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controller for company management.
 *
 * Creating a company whose name matches an existing one returns the existing
 * company with 200 instead of 201.
 */
@RestController
@RequestMapping("/v1/companies")
@RequiredArgsConstructor
public class CompanyController {

    private final OwnershipGuard ownershipGuard;
    private final CompanyService companyService;
    private final JobService jobService;

    @GetMapping
    public Mono<PageResponse<CompanyResponse>> listCompanies(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> companyService.list(ownerId, PaginationPolicy.resolve(page, limit)));
    }

    @GetMapping("/{id}")
    public Mono<CompanyResponse> getCompany(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> companyService.get(ownerId, id));
    }

    @GetMapping("/{id}/jobs")
    public Flux<JobResponse> listCompanyJobs(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMapMany(ownerId -> jobService.listByCompany(ownerId, id));
    }

    @PostMapping
    public Mono<ResponseEntity<CompanyResponse>> createCompany(@Valid @RequestBody CompanyRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> companyService.create(ownerId, request))
                .map(outcome -> ResponseEntity
                        .status(outcome.isExisted() ? HttpStatus.OK : HttpStatus.CREATED)
                        .body(outcome.getResource()));
    }

    @PutMapping("/{id}")
    public Mono<CompanyResponse> updateCompany(
            @PathVariable Long id,
            @Valid @RequestBody CompanyRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> companyService.update(ownerId, id, request));
    }

    @DeleteMapping("/{id}")
    public Mono<Map<String, Object>> deleteCompany(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> companyService.delete(ownerId, id))
                .thenReturn(Map.of("deleted", true, "id", id));
    }
}
