package com.resumecontrol.service;

import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.StoreException;
import com.resumecontrol.model.dto.ApplicationDetailsRequest;
import com.resumecontrol.model.dto.ApplicationDetailsResponse;
import com.resumecontrol.model.dto.ApplicationResponse;
import com.resumecontrol.model.dto.CompanyResponse;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.StepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Updates an application, the company of its job and the job itself in one request.
 *
 * Each step is atomic on its own; there is no transaction across them. The
 * first failing step stops the sequence and earlier steps stay applied. The
 * response reports which steps ran and how they ended.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationDetailsService {

    static final String STEP_APPLICATION = "application";
    static final String STEP_COMPANY = "company";
    static final String STEP_JOB = "job";

    private final ApplicationService applicationService;
    private final CompanyService companyService;
    private final JobService jobService;

    /**
     * Apply the parts present in the request, in order: application, company, job.
     *
     * When the very first attempted step fails nothing was changed, and its error
     * is returned as is. A later failure yields a response with
     * {@code complete=false}.
     *
     * @param ownerId       Owner ID
     * @param applicationId Application ID
     * @param request       Parts to update
     * @return per-step outcome plus the updated resources
     */
    public Mono<ApplicationDetailsResponse> updateDetails(UUID ownerId, Long applicationId,
                                                          ApplicationDetailsRequest request) {
        if (request == null || (request.getApplication() == null
                && request.getCompany() == null
                && request.getJob() == null)) {
            return Mono.error(new InvalidArgumentException("details",
                    "At least one of application, company or job is required"));
        }

        return Mono.defer(() -> {
            Progress progress = new Progress();

            Supplier<Mono<?>> applicationStep = request.getApplication() == null ? null
                    : () -> applicationService.update(ownerId, applicationId, request.getApplication())
                            .doOnNext(updated -> progress.application = updated);
            Supplier<Mono<?>> companyStep = request.getCompany() == null ? null
                    : () -> jobService.getByApplication(ownerId, applicationId)
                            .flatMap(job -> companyService.update(ownerId, job.getCompanyId(), request.getCompany()))
                            .doOnNext(updated -> progress.company = updated);
            Supplier<Mono<?>> jobStep = request.getJob() == null ? null
                    : () -> jobService.getByApplication(ownerId, applicationId)
                            .flatMap(job -> jobService.update(ownerId, job.getId(), request.getJob()))
                            .doOnNext(updated -> progress.job = updated);

            return applicationService.get(ownerId, applicationId)
                    .doOnNext(current -> progress.application = current)
                    .then(runStep(progress, STEP_APPLICATION, applicationStep))
                    .flatMap(ok -> ok ? runStep(progress, STEP_COMPANY, companyStep) : Mono.just(false))
                    .flatMap(ok -> ok ? runStep(progress, STEP_JOB, jobStep) : Mono.just(false))
                    .flatMap(ok -> finish(ownerId, applicationId, progress, ok));
        });
    }

    private Mono<Boolean> runStep(Progress progress, String name, Supplier<Mono<?>> step) {
        if (step == null) {
            return Mono.just(true);
        }
        return Mono.defer(step)
                .then(Mono.fromCallable(() -> {
                    progress.steps.add(StepResult.builder().step(name).status(StepResult.OK).build());
                    return true;
                }))
                .onErrorResume(e -> {
                    progress.failure = e;
                    progress.steps.add(StepResult.builder()
                            .step(name)
                            .status(StepResult.FAILED)
                            .detail(e instanceof StoreException ? "Internal server error" : e.getMessage())
                            .build());
                    return Mono.just(false);
                });
    }

    private Mono<ApplicationDetailsResponse> finish(UUID ownerId, Long applicationId, Progress progress,
                                                    boolean complete) {
        if (!complete && progress.succeeded() == 0) {
            return Mono.error(progress.failure);
        }
        if (complete) {
            log.info("Updated details of application {} for owner {}", applicationId, ownerId);
        } else {
            log.warn("Details update of application {} for owner {} stopped after {} step(s): {}",
                    applicationId, ownerId, progress.succeeded(), progress.failure.getMessage());
        }
        return Mono.just(ApplicationDetailsResponse.builder()
                .complete(complete)
                .steps(progress.steps)
                .application(progress.application)
                .company(progress.company)
                .job(progress.job)
                .build());
    }

    /**
     * Mutable state of one call.
     */
    private static final class Progress {
        private final List<StepResult> steps = new ArrayList<>();
        private ApplicationResponse application;
        private CompanyResponse company;
        private JobResponse job;
        private Throwable failure;

        private long succeeded() {
            return steps.stream().filter(step -> StepResult.OK.equals(step.getStatus())).count();
        }
    }
}
