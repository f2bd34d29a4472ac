package com.resumecontrol.service;

import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.model.dto.ContactRequest;
import com.resumecontrol.model.dto.ContactResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.model.entity.Contact;
import com.resumecontrol.repository.ContactRepository;
import com.resumecontrol.util.Fields;
import com.resumecontrol.util.PageBounds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Service for contact management.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContactService implements OwnedResourceService<ContactResponse, ContactRequest> {

    private static final String RESOURCE = "Contact";

    private final ContactRepository contactRepository;

    @Override
    public Mono<PageResponse<ContactResponse>> list(UUID ownerId, PageBounds bounds) {
        return OwnedRows.page(RESOURCE, bounds,
                contactRepository.countByOwnerId(ownerId),
                () -> contactRepository.findPageByOwnerId(ownerId, bounds.getLimit(), bounds.getOffset())
                        .map(this::toResponse));
    }

    @Override
    public Mono<ContactResponse> get(UUID ownerId, Long id) {
        return OwnedRows.required(contactRepository.findByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .map(this::toResponse);
    }

    public Mono<ContactResponse> create(UUID ownerId, ContactRequest request) {
        return Mono.defer(() -> {
            LocalDateTime now = LocalDateTime.now();
            Contact contact = Contact.builder()
                    .ownerId(ownerId)
                    .name(Fields.requireText(request.getName(), "name"))
                    .email(Fields.optionalText(request.getEmail()))
                    .phone(Fields.optionalText(request.getPhone()))
                    .linkedin(Fields.optionalText(request.getLinkedin()))
                    .createdAt(now)
                    .updatedAt(now)
                    .build();

            return contactRepository.save(contact)
                    .doOnNext(saved -> log.info("Created contact {} for owner {}", saved.getId(), ownerId))
                    .map(this::toResponse)
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("create contact", e));
        });
    }

    @Override
    public Mono<ContactResponse> update(UUID ownerId, Long id, ContactRequest request) {
        return Mono.defer(() -> {
            String name = Fields.requireText(request.getName(), "name");
            return OwnedRows.affected(contactRepository.updateByIdAndOwnerId(id, ownerId, name,
                            Fields.optionalText(request.getEmail()),
                            Fields.optionalText(request.getPhone()),
                            Fields.optionalText(request.getLinkedin())), RESOURCE, id)
                    .onErrorMap(StoreErrors::isStoreFailure, e -> OwnedRows.failure("update contact", e))
                    .then(Mono.defer(() -> get(ownerId, id)))
                    .doOnNext(updated -> log.info("Updated contact {} for owner {}", id, ownerId));
        });
    }

    /**
     * Delete a contact. Applications that referenced it keep existing without a contact.
     */
    @Override
    public Mono<Void> delete(UUID ownerId, Long id) {
        return OwnedRows.deleted(contactRepository.deleteByIdAndOwnerId(id, ownerId), RESOURCE, id)
                .doOnSuccess(ignored -> log.info("Deleted contact {} for owner {}", id, ownerId));
    }

    private ContactResponse toResponse(Contact contact) {
        return ContactResponse.builder()
                .id(contact.getId())
                .name(contact.getName())
                .email(contact.getEmail())
                .phone(contact.getPhone())
                .linkedin(contact.getLinkedin())
                .createdAt(contact.getCreatedAt())
                .updatedAt(contact.getUpdatedAt())
                .build();
    }
}
