package com.resumecontrol.service;

import com.resumecontrol.exception.DuplicateResourceException;
import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.model.dto.ApplicationDetailsRequest;
import com.resumecontrol.model.dto.ApplicationRequest;
import com.resumecontrol.model.dto.ApplicationResponse;
import com.resumecontrol.model.dto.CompanyRequest;
import com.resumecontrol.model.dto.CompanyResponse;
import com.resumecontrol.model.dto.JobRequest;
import com.resumecontrol.model.dto.JobResponse;
import com.resumecontrol.model.dto.StepResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ApplicationDetailsService.
 */
@ExtendWith(MockitoExtension.class)
class ApplicationDetailsServiceTest {

    @Mock
    private ApplicationService applicationService;

    @Mock
    private CompanyService companyService;

    @Mock
    private JobService jobService;

    @InjectMocks
    private ApplicationDetailsService detailsService;

    private UUID ownerId;
    private ApplicationRequest applicationRequest;
    private CompanyRequest companyRequest;
    private JobRequest jobRequest;
    private ApplicationResponse application;
    private JobResponse job;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
        applicationRequest = ApplicationRequest.builder().status("interview").appliedDate("2024-02-01").build();
        companyRequest = CompanyRequest.builder().name("Initech").build();
        jobRequest = JobRequest.builder().title("Staff Engineer").build();
        application = ApplicationResponse.builder().id(1L).status("applied").build();
        job = JobResponse.builder().id(3L).applicationId(1L).companyId(2L).title("Engineer").build();
    }

    private ApplicationDetailsRequest fullRequest() {
        return ApplicationDetailsRequest.builder()
                .application(applicationRequest)
                .company(companyRequest)
                .job(jobRequest)
                .build();
    }

    @Test
    void updateDetails_AllStepsSucceed() {
        when(applicationService.get(ownerId, 1L)).thenReturn(Mono.just(application));
        when(applicationService.update(ownerId, 1L, applicationRequest))
                .thenReturn(Mono.just(ApplicationResponse.builder().id(1L).status("interview").build()));
        when(jobService.getByApplication(ownerId, 1L)).thenReturn(Mono.just(job));
        when(companyService.update(ownerId, 2L, companyRequest))
                .thenReturn(Mono.just(CompanyResponse.builder().id(2L).name("Initech").build()));
        when(jobService.update(ownerId, 3L, jobRequest))
                .thenReturn(Mono.just(JobResponse.builder().id(3L).title("Staff Engineer").build()));

        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, fullRequest()))
                .expectNextMatches(response -> response.isComplete()
                        && response.getSteps().size() == 3
                        && response.getSteps().stream().allMatch(step -> StepResult.OK.equals(step.getStatus()))
                        && response.getApplication().getStatus().equals("interview")
                        && response.getCompany().getName().equals("Initech")
                        && response.getJob().getTitle().equals("Staff Engineer"))
                .verifyComplete();
    }

    @Test
    void updateDetails_StopsAtFirstFailureWithoutRollback() {
        when(applicationService.get(ownerId, 1L)).thenReturn(Mono.just(application));
        when(applicationService.update(ownerId, 1L, applicationRequest))
                .thenReturn(Mono.just(ApplicationResponse.builder().id(1L).status("interview").build()));
        when(jobService.getByApplication(ownerId, 1L)).thenReturn(Mono.just(job));
        when(companyService.update(ownerId, 2L, companyRequest))
                .thenReturn(Mono.error(new DuplicateResourceException("Company", "Initech", 9L)));

        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, fullRequest()))
                .expectNextMatches(response -> !response.isComplete()
                        && response.getSteps().size() == 2
                        && StepResult.OK.equals(response.getSteps().get(0).getStatus())
                        && ApplicationDetailsService.STEP_COMPANY.equals(response.getSteps().get(1).getStep())
                        && StepResult.FAILED.equals(response.getSteps().get(1).getStatus())
                        && response.getSteps().get(1).getDetail().contains("Initech")
                        && response.getApplication().getStatus().equals("interview"))
                .verifyComplete();

        verify(jobService, never()).update(any(UUID.class), anyLong(), any(JobRequest.class));
    }

    @Test
    void updateDetails_FirstStepFailureIsReturnedAsIs() {
        when(applicationService.get(ownerId, 1L)).thenReturn(Mono.just(application));
        when(applicationService.update(ownerId, 1L, applicationRequest))
                .thenReturn(Mono.error(new InvalidArgumentException("status", "bad status")));

        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, fullRequest()))
                .expectError(InvalidArgumentException.class)
                .verify();

        verifyNoInteractions(companyService);
    }

    @Test
    void updateDetails_SkipsAbsentParts() {
        when(applicationService.get(ownerId, 1L)).thenReturn(Mono.just(application));
        when(jobService.getByApplication(ownerId, 1L)).thenReturn(Mono.just(job));
        when(jobService.update(ownerId, 3L, jobRequest))
                .thenReturn(Mono.just(JobResponse.builder().id(3L).title("Staff Engineer").build()));

        ApplicationDetailsRequest request = ApplicationDetailsRequest.builder().job(jobRequest).build();

        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, request))
                .expectNextMatches(response -> response.isComplete()
                        && response.getSteps().size() == 1
                        && ApplicationDetailsService.STEP_JOB.equals(response.getSteps().get(0).getStep()))
                .verifyComplete();

        verify(applicationService, never()).update(any(UUID.class), anyLong(), any(ApplicationRequest.class));
        verifyNoInteractions(companyService);
    }

    @Test
    void updateDetails_OtherOwnersApplicationIsNotFound() {
        when(applicationService.get(ownerId, 1L)).thenReturn(Mono.error(new ResourceNotFoundException("Application", 1L)));

        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, fullRequest()))
                .expectError(ResourceNotFoundException.class)
                .verify();

        verifyNoInteractions(companyService, jobService);
    }

    @Test
    void updateDetails_EmptyRequestIsInvalid() {
        StepVerifier.create(detailsService.updateDetails(ownerId, 1L, new ApplicationDetailsRequest()))
                .expectError(InvalidArgumentException.class)
                .verify();

        verifyNoInteractions(applicationService, companyService, jobService);
    }
}
