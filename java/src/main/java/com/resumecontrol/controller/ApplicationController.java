package com.resumecontrol.controller;

import com.resumecontrol.model.dto.ApplicationDetailsRequest;
import com.resumecontrol.model.dto.ApplicationDetailsResponse;
import com.resumecontrol.model.dto.ApplicationRequest;
import com.resumecontrol.model.dto.ApplicationResponse;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.ApplicationDetailsService;
import com.resumecontrol.service.ApplicationService;
import com.resumecontrol.service.JobService;
import com.resumecontrol.util.PaginationPolicy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controller for job application management.
 */
@RestController
@RequestMapping("/v1/applications")
@RequiredArgsConstructor
public class ApplicationController {

    private final OwnershipGuard ownershipGuard;
    private final ApplicationService applicationService;
    private final ApplicationDetailsService applicationDetailsService;
    private final JobService jobService;

    @GetMapping
    public Mono<PageResponse<ApplicationResponse>> listApplications(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationService.list(ownerId, status, PaginationPolicy.resolve(page, limit)));
    }

    @GetMapping("/{id}")
    public Mono<ApplicationResponse> getApplication(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationService.get(ownerId, id));
    }

    @GetMapping("/{id}/job")
    public Mono<JobResponse> getApplicationJob(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.getByApplication(ownerId, id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApplicationResponse> createApplication(@Valid @RequestBody ApplicationRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationService.create(ownerId, request));
    }

    @PutMapping("/{id}")
    public Mono<ApplicationResponse> updateApplication(
            @PathVariable Long id,
            @Valid @RequestBody ApplicationRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationService.update(ownerId, id, request));
    }

    @PutMapping("/{id}/details")
    public Mono<ApplicationDetailsResponse> updateApplicationDetails(
            @PathVariable Long id,
            @RequestBody ApplicationDetailsRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationDetailsService.updateDetails(ownerId, id, request));
    }

    @DeleteMapping("/{id}")
    public Mono<Map<String, Object>> deleteApplication(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> applicationService.delete(ownerId, id))
                .thenReturn(Map.of("deleted", true, "id", id));
    }
}
