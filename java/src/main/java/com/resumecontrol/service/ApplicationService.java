package com.resumecontrol.service;

import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.model.dto.ApplicationRequest;
import com.resumecontrol.model.dto.ApplicationResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.model.entity.Application;
import com.resumecontrol.model.entity.ApplicationStatus;
import com.resumecontrol.repository.ApplicationRepository;
import com.resumecontrol.repository.ContactRepository;
import com.resumecontrol.util.Fields;
import com.resumecontrol.util.PageBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Service for job application management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationService implements OwnedResourceService<ApplicationResponse, ApplicationRequest> {

    private static final String RESOURCE = "Application";

    private final ApplicationRepository applicationRepository;
    private final ContactRepository contactRepository;

    @Override
    public Mono<PageResponse<ApplicationResponse>> list(UUID ownerId, PageBounds bounds) {
        return OwnedRows.page(RESOURCE, bounds,
                applicationRepository.countByOwnerId(ownerId),
                () -> applicationRepository.findPageByOwnerId(ownerId, bounds.getLimit(), bounds.getOffset())
                        .map(this::toResponse));
    }

    /**
     * List applications, optionally restricted to one status.
     *
     * @param ownerId Owner ID
     * @param status  Status wire value, or {@code null} for all
     * @param bounds  Page bounds
     * @return one page of applications
     */
    public Mono<PageResponse<ApplicationResponse>> list(UUID ownerId, String status, PageBounds bounds) {
        if (Fields.optionalText(status) == null) {
            return list(ownerId, bounds);
        }
        return Mono.defer(() -> {
            String value = parseStatus(status).getValue();
            return OwnedRows.page(RESOURCE, bounds,
                    applicationRepository.countByOwnerIdAndStatus(ownerId, value),
                    () -> applicationRepository.findPageByOwnerIdAndStatus(
                                    ownerId, value, bounds.getLimit(), bounds.getOffset())
                            .map(this::toResponse));
        });
    }

    @Override
    public Mono<ApplicationResponse> get(UUID ownerId, Long id) {
        return OwnedRows.required(applicationRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .map(this::toResponse);
    }

    public Mono<ApplicationResponse> create(UUID ownerId, ApplicationRequest request) {
        return Mono.defer(() -> {
            ApplicationStatus status = parseStatus(request.getStatus());
            LocalDate appliedDate = Fields.requireDate(request.getAppliedDate(), "applied_date");
            Long contactId = request.getContactId();
            String notes = Fields.optionalText(request.getNotes());

            LocalDateTime now = LocalDateTime.now();
            Application application = Application.builder()
                    .ownerId(ownerId)
                    .status(status.getValue())
                    .appliedDate(appliedDate)
                    .contactId(contactId)
                    .notes(notes)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            return verifyContact(ownerId, contactId)
                    .then(Mono.defer(() -> applicationRepository.save(application)))
                    .doOnNext(saved -> log.info("Created application {} ({}) for owner {}",
                            saved.getId(), saved.getStatus(), ownerId))
                    .map(this::toResponse)
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("create application", e));
        });
    }

    @Override
    public Mono<ApplicationResponse> update(UUID ownerId, Long id, ApplicationRequest request) {
        return Mono.defer(() -> {
            ApplicationStatus status = parseStatus(request.getStatus());
            LocalDate appliedDate = Fields.requireDate(request.getAppliedDate(), "applied_date");
            Long contactId = request.getContactId();
            String notes = Fields.optionalText(request.getNotes());

            return OwnedRows.required(applicationRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                    .then(verifyContact(ownerId, contactId))
                    .then(OwnedRows.affected(Mono.defer(() -> applicationRepository.updateByIdAndOwnerId(
                            id, ownerId, status.getValue(), appliedDate, contactId, notes)), RESOURCE, id))
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("update application", e))
                    .then(Mono.defer(() -> get(ownerId, id)))
                    .doOnNext(updated -> log.info("Updated application {} for owner {}", id, ownerId));
        });
    }

    /**
     * Delete an application together with its job.
     */
    @Override
    public Mono<Void> delete(UUID ownerId, Long id) {
        return OwnedRows.deleted(applicationRepository.deleteByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .doOnSuccess(ignored -> log.info("Deleted application {} for owner {}", id, ownerId));
    }

    /**
     * A referenced contact must exist and belong to the same owner.
     */
    private Mono<Void> verifyContact(UUID ownerId, Long contactId) {
        if (contactId == null) {
            return Mono.empty();
        }
        return contactRepository.findByIdAndOwnerId(contactId, ownerId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Contact", contactId)))
                .then();
    }

    static ApplicationStatus parseStatus(String value) {
        String text = Fields.requireText(value, "status");
        return ApplicationStatus.fromValue(text)
                .orElseThrow(() -> new InvalidArgumentException("status",
                        "status must be one of: " + Arrays.stream(ApplicationStatus.values())
                                .map(ApplicationStatus::getValue)
                                .collect(Collectors.joining(", "))));
    }

    ApplicationResponse toResponse(Application application) {
        return ApplicationResponse.builder()
                .id(application.getId())
                .status(application.getStatus())
                .appliedDate(application.getAppliedDate())
                .contactId(application.getContactId())
                .notes(application.getNotes())
                .createdAt(application.getCreatedAt())
                .updatedAt(application.getUpdatedAt())
                .build();
    }
}
