package com.resumecontrol.service;

import com.resumecontrol.exception.DuplicateResourceException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.model.dto.JobRequest;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.model.entity.Application;
import com.resumecontrol.model.entity.Job;
import com.resumecontrol.repository.ApplicationRepository;
import com.resumecontrol.repository.CompanyRepository;
import com.resumecontrol.repository.JobRepository;
import com.resumecontrol.util.Fields;
import com.resumecontrol.util.PageBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for job management.
 *
 * A job belongs to one application and names one company. Its owner is always
 * the owner of its application.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobService implements OwnedResourceService<JobResponse, JobRequest> {

    private static final String RESOURCE = "Job";

    private final JobRepository jobRepository;
    private final ApplicationRepository applicationRepository;
    private final CompanyRepository companyRepository;

    @Override
    public Mono<PageResponse<JobResponse>> list(UUID ownerId, PageBounds bounds) {
        return OwnedRows.page(RESOURCE, bounds,
                jobRepository.countByOwnerId(ownerId),
                () -> jobRepository.findPageByOwnerId(ownerId, bounds.getLimit(), bounds.getOffset())
                        .map(this::toResponse));
    }

    @Override
    public Mono<JobResponse> get(UUID ownerId, Long id) {
        return OwnedRows.required(jobRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .map(this::toResponse);
    }

    /**
     * Jobs at one of the owner's companies.
     */
    public Flux<JobResponse> listByCompany(UUID ownerId, Long companyId) {
        return OwnedRows.required(companyRepository.findByIdAndOwnerId(companyId, ownerId), "Company", companyId)
                .flatMapMany(company -> jobRepository.findByCompanyIdAndOwnerId(companyId, ownerId))
                .map(this::toResponse)
                .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("list jobs", e));
    }

    /**
     * The job attached to one of the owner's applications.
     */
    public Mono<JobResponse> getByApplication(UUID ownerId, Long applicationId) {
        return OwnedRows.required(applicationRepository.findByIdAndOwnerId(applicationId, ownerId),
                        "Application", applicationId)
                .flatMap(application -> OwnedRows.required(
                        jobRepository.findByApplicationIdAndOwnerId(applicationId, ownerId),
                        RESOURCE, "application " + applicationId))
                .map(this::toResponse);
    }

    /**
     * Create the job of an application. Both the application and the company
     * must belong to the caller; an application that already has a job is a conflict.
     */
    public Mono<JobResponse> create(UUID ownerId, JobRequest request) {
        return Mono.defer(() -> {
            String title = Fields.requireText(request.getTitle(), "title");
            Long applicationId = Fields.requirePresent(request.getApplicationId(), "application_id");
            Long companyId = Fields.requirePresent(request.getCompanyId(), "company_id");

            return OwnedRows.required(applicationRepository.findByIdAndOwnerId(applicationId, ownerId),
                            "Application", applicationId)
                    .flatMap(application -> verifyCompany(ownerId, companyId).thenReturn(application))
                    .flatMap(application -> insert(application, companyId, title, request))
                    .map(this::toResponse);
        });
    }

    @Override
    public Mono<JobResponse> update(UUID ownerId, Long id, JobRequest request) {
        return Mono.defer(() -> {
            String title = Fields.requireText(request.getTitle(), "title");

            return OwnedRows.required(jobRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                    .flatMap(current -> {
                        Long companyId = request.getCompanyId() != null
                                ? request.getCompanyId()
                                : current.getCompanyId();
                        return verifyCompany(ownerId, companyId)
                                .then(OwnedRows.affected(Mono.defer(() -> jobRepository.updateByIdAndOwnerId(
                                        id, ownerId, companyId, title,
                                        Fields.optionalText(request.getDescription()),
                                        Fields.optionalText(request.getRequirements()),
                                        Fields.optionalText(request.getLocation()))), RESOURCE, id));
                    })
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("update job", e))
                    .then(Mono.defer(() -> get(ownerId, id)))
                    .doOnNext(updated -> log.info("Updated job {} for owner {}", id, ownerId));
        });
    }

    @Override
    public Mono<Void> delete(UUID ownerId, Long id) {
        return OwnedRows.deleted(jobRepository.deleteByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .doOnSuccess(ignored -> log.info("Deleted job {} for owner {}", id, ownerId));
    }

    private Mono<Job> insert(Application application, Long companyId, String title, JobRequest request) {
        LocalDateTime now = LocalDateTime.now();
        Job job = Job.builder()
                .ownerId(application.getOwnerId())
                .applicationId(application.getId())
                .companyId(companyId)
                .title(title)
                .description(Fields.optionalText(request.getDescription()))
                .requirements(Fields.optionalText(request.getRequirements()))
                .location(Fields.optionalText(request.getLocation()))
                .createdAt(now)
                .updatedAt(now)
                .build();

        return jobRepository.save(job)
                .doOnNext(saved -> log.info("Created job {} for application {} (owner {})",
                        saved.getId(), application.getId(), application.getOwnerId()))
                .onErrorResume(StoreErrors::isUniqueViolation, e -> jobRepository
                        .findByApplicationIdAndOwnerId(application.getId(), application.getOwnerId())
                        .map(Job::getId)
                        .defaultIfEmpty(-1L)
                        .flatMap(existingId -> Mono.<Job>error(new DuplicateResourceException(
                                RESOURCE, "application " + application.getId(),
                                existingId > 0 ? existingId : null))))
                .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("create job", e));
    }

    private Mono<Void> verifyCompany(UUID ownerId, Long companyId) {
        return companyRepository.findByIdAndOwnerId(companyId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Company", companyId)))
                .then();
    }

    JobResponse toResponse(Job job) {
        return JobResponse.builder()
                .id(job.getId())
                .applicationId(job.getApplicationId())
                .companyId(job.getCompanyId())
                .title(job.getTitle())
                .description(job.getDescription())
                .requirements(job.getRequirements())
                .location(job.getLocation())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .build();
    }
}
