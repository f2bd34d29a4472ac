package com.resumecontrol.controller;

import com.resumecontrol.exception.GlobalExceptionHandler;
import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreException;
import com.resumecontrol.model.dto.ApplicationDetailsRequest;
import com.resumecontrol.model.dto.ApplicationDetailsResponse;
import com.resumecontrol.model.dto.ApplicationRequest;
import com.resumecontrol.model.dto.ApplicationResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.model.dto.StepResult;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.ApplicationDetailsService;
import com.resumecontrol.service.ApplicationService;
import com.resumecontrol.service.JobService;
import com.resumecontrol.util.PageBounds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Tests for ApplicationController with the global exception handler.
 */
@ExtendWith(MockitoExtension.class)
class ApplicationControllerTest {

    @Mock
    private OwnershipGuard ownershipGuard;

    @Mock
    private ApplicationService applicationService;

    @Mock
    private ApplicationDetailsService applicationDetailsService;

    @Mock
    private JobService jobService;

    private WebTestClient webTestClient;
    private UUID ownerId;
    private ApplicationResponse application;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient
                .bindToController(new ApplicationController(
                        ownershipGuard, applicationService, applicationDetailsService, jobService))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
        ownerId = UUID.randomUUID();
        application = ApplicationResponse.builder()
                .id(7L)
                .status("interview")
                .appliedDate(LocalDate.of(2024, 1, 15))
                .build();
        when(ownershipGuard.authorize()).thenReturn(Mono.just(ownerId));
    }

    @Test
    void listApplications_PassesStatusFilter() {
        PageBounds bounds = new PageBounds(2, 5);
        when(applicationService.list(ownerId, "interview", bounds))
                .thenReturn(Mono.just(PageResponse.of(List.of(application), bounds, 6L)));

        webTestClient.get()
                .uri("/v1/applications?status=interview&page=2&limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].status").isEqualTo("interview")
                .jsonPath("$.data[0].applied_date").isEqualTo("2024-01-15")
                .jsonPath("$.meta.total_pages").isEqualTo(2);
    }

    @Test
    void listApplications_UnknownStatusIsBadRequest() {
        when(applicationService.list(ownerId, "pending", new PageBounds(1, 10)))
                .thenReturn(Mono.error(new InvalidArgumentException("status", "status must be one of: applied")));

        webTestClient.get()
                .uri("/v1/applications?status=pending")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_argument");
    }

    @Test
    void createApplication_ReturnsCreated() {
        when(applicationService.create(eq(ownerId), any(ApplicationRequest.class))).thenReturn(Mono.just(application));

        webTestClient.post()
                .uri("/v1/applications")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"status\": \"interview\", \"applied_date\": \"2024-01-15\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(7)
                .jsonPath("$.applied_date").isEqualTo("2024-01-15");
    }

    @Test
    void getApplicationJob_WithoutJobIsNotFound() {
        when(jobService.getByApplication(ownerId, 7L))
                .thenReturn(Mono.error(new ResourceNotFoundException("Job", "application 7")));

        webTestClient.get()
                .uri("/v1/applications/7/job")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void updateApplicationDetails_ReportsPartialSuccess() {
        ApplicationDetailsResponse partial = ApplicationDetailsResponse.builder()
                .complete(false)
                .steps(List.of(
                        StepResult.builder().step("application").status(StepResult.OK).build(),
                        StepResult.builder().step("company").status(StepResult.FAILED)
                                .detail("Company with identifier 'Initech' already exists").build()))
                .application(application)
                .build();
        when(applicationDetailsService.updateDetails(eq(ownerId), eq(7L), any(ApplicationDetailsRequest.class)))
                .thenReturn(Mono.just(partial));

        webTestClient.put()
                .uri("/v1/applications/7/details")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"application\": {\"status\": \"interview\", \"applied_date\": \"2024-01-15\"},"
                        + " \"company\": {\"name\": \"Initech\"}}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.complete").isEqualTo(false)
                .jsonPath("$.steps[0].status").isEqualTo("ok")
                .jsonPath("$.steps[1].status").isEqualTo("failed")
                .jsonPath("$.job").doesNotExist();
    }

    @Test
    void getApplication_StoreFailureHidesDetails() {
        when(applicationService.get(ownerId, 7L))
                .thenReturn(Mono.error(new StoreException("Failed to fetch Application", new IllegalStateException("pool closed"))));

        webTestClient.get()
                .uri("/v1/applications/7")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("internal")
                .jsonPath("$.detail").isEqualTo("Internal server error");
    }

    @Test
    void deleteApplication_Success() {
        when(applicationService.delete(ownerId, 7L)).thenReturn(Mono.empty());

        webTestClient.delete()
                .uri("/v1/applications/7")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.deleted").isEqualTo(true)
                .jsonPath("$.id").isEqualTo(7);
    }
}
