package com.resumecontrol.controller;

import com.resumecontrol.model.dto.ContactRequest;
import com.resumecontrol.model.dto.ContactResponse;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.security.OwnershipGuard;
import com.resumecontrol.service.ContactService;
import com.resumecontrol.util.PaginationPolicy;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/v1/contacts")
@RequiredArgsConstructor
public class ContactController {

    private final OwnershipGuard ownershipGuard;
    private final ContactService contactService;

    @GetMapping
    public Mono<PageResponse<ContactResponse>> listContacts(
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> contactService.list(ownerId, PaginationPolicy.resolve(page, limit)));
    }

    @GetMapping("/{id}")
    public Mono<ContactResponse> getContact(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> contactService.get(ownerId, id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ContactResponse> createContact(@Valid @RequestBody ContactRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> contactService.create(ownerId, request));
    }

    @PutMapping("/{id}")
    public Mono<ContactResponse> updateContact(
            @PathVariable Long id,
            @Valid @RequestBody ContactRequest request) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> contactService.update(ownerId, id, request));
    }

    @DeleteMapping("/{id}")
    public Mono<Map<String, Object>> deleteContact(@PathVariable Long id) {
        return ownershipGuard.authorize()
                .flatMap(ownerId -> contactService.delete(ownerId, id))
                .thenReturn(Map.of("deleted", true, "id", id));
    }
}
