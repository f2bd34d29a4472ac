package com.resumecontrol.controller;

import com.resumecontrol.model.dto.JobRequest;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.JobService;
import com.resumecontrol.util.PaginationPolicy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Controller for job management.
 */
@RestController
@RequestMapping("/v1/jobs")
@RequiredArgsConstructor
public class JobController {

    private final OwnershipGuard ownershipGuard;
    private final JobService jobService;

    @GetMapping
    public Mono<PageResponse<JobResponse>> listJobs(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.list(ownerId, PaginationPolicy.resolve(page, limit)));
    }

    @GetMapping("/{id}")
    public Mono<JobResponse> getJob(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.get(ownerId, id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<JobResponse> createJob(@Valid @RequestBody JobRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.create(ownerId, request));
    }

    @PutMapping("/{id}")
    public Mono<JobResponse> updateJob(
            @PathVariable Long id,
            @Valid @RequestBody JobRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.update(ownerId, id, request));
    }

    @DeleteMapping("/{id}")
    public Mono<Map<String, Object>> deleteJob(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> jobService.delete(ownerId, id))
                .thenReturn(Map.of("deleted", true, "id", id));
    }
}
