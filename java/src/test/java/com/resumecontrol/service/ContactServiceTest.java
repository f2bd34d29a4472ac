package com.resumecontrol.service;

import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreException;
import com.resumecontrol.model.dto.ContactRequest;
import com.resumecontrol.model.entity.Contact;
import com.resumecontrol.repository.ContactRepository;
import com.resumecontrol.util.PaginationPolicy;
import io.r2dbc.spi.R2dbcDataIntegrityViolationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ContactService.
 */
@ExtendWith(MockitoExtension.class)
class ContactServiceTest {

    @Mock
    private ContactRepository contactRepository;

    @InjectMocks
    private ContactService contactService;

    private UUID ownerId;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
    }

    @Test
    void create_BlankOptionalFieldsAreStoredAsAbsent() {
        when(contactRepository.save(any(Contact.class))).thenAnswer(invocation -> {
            Contact contact = invocation.getArgument(0);
            contact.setId(1L);
            return Mono.just(contact);
        });

        ContactRequest request = ContactRequest.builder()
                .name("  Jane Doe ")
                .email("jane@example.com")
                .phone("   ")
                .build();

        StepVerifier.create(contactService.create(ownerId, request))
                .expectNextMatches(response -> response.getId().equals(1L)
                        && response.getName().equals("Jane Doe"))
                .verifyComplete();

        ArgumentCaptor<Contact> captor = ArgumentCaptor.forClass(Contact.class);
        verify(contactRepository).save(captor.capture());
        assertEquals(ownerId, captor.getValue().getOwnerId());
        assertNull(captor.getValue().getPhone());
        assertNull(captor.getValue().getLinkedin());
    }

    @Test
    void create_BlankNameIsInvalid() {
        StepVerifier.create(contactService.create(ownerId, ContactRequest.builder().name(" ").build()))
                .expectError(InvalidArgumentException.class)
                .verify();

        verifyNoInteractions(contactRepository);
    }

    @Test
    void create_StoreFailureIsInternal() {
        when(contactRepository.save(any(Contact.class)))
                .thenReturn(Mono.error(new DataAccessResourceFailureException("connection refused")));

        StepVerifier.create(contactService.create(ownerId, ContactRequest.builder().name("Jane").build()))
                .expectError(StoreException.class)
                .verify();
    }

    @Test
    void create_ValueTooLongForColumnIsInvalid() {
        when(contactRepository.save(any(Contact.class)))
                .thenReturn(Mono.error(new DataIntegrityViolationException("insert failed",
                        new R2dbcDataIntegrityViolationException("value too long for type character varying(64)",
                                "22001"))));

        StepVerifier.create(contactService.create(ownerId, ContactRequest.builder().name("Jane").phone("5").build()))
                .expectError(InvalidArgumentException.class)
                .verify();
    }

    @Test
    void get_OtherOwnersContactIsNotFound() {
        UUID otherOwner = UUID.randomUUID();
        when(contactRepository.findByIdAndOwnerId(1L, otherOwner)).thenReturn(Mono.empty());

        StepVerifier.create(contactService.get(otherOwner, 1L))
                .expectErrorMatches(error -> error instanceof ResourceNotFoundException
                        && "Contact".equals(((ResourceNotFoundException) error).getResource()))
                .verify();
    }

    @Test
    void list_ReturnsPage() {
        Contact contact = Contact.builder().id(1L).ownerId(ownerId).name("Jane").build();
        when(contactRepository.countByOwnerId(ownerId)).thenReturn(Mono.just(1L));
        when(contactRepository.findPageByOwnerId(ownerId, 10, 0L)).thenReturn(Flux.just(contact));

        StepVerifier.create(contactService.list(ownerId, PaginationPolicy.defaults()))
                .expectNextMatches(page -> page.getData().size() == 1
                        && page.getMeta().getTotalPages() == 1)
                .verifyComplete();
    }

    @Test
    void update_OtherOwnersContactIsNotFound() {
        UUID otherOwner = UUID.randomUUID();
        when(contactRepository.updateByIdAndOwnerId(1L, otherOwner, "Jane", null, null, null))
                .thenReturn(Mono.just(0));

        StepVerifier.create(contactService.update(otherOwner, 1L, ContactRequest.builder().name("Jane").build()))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void update_ReturnsStoredRow() {
        Contact updated = Contact.builder().id(1L).ownerId(ownerId).name("Jane Roe").build();
        when(contactRepository.updateByIdAndOwnerId(1L, ownerId, "Jane Roe", null, null, null))
                .thenReturn(Mono.just(1));
        when(contactRepository.findByIdAndOwnerId(1L, ownerId)).thenReturn(Mono.just(updated));

        StepVerifier.create(contactService.update(ownerId, 1L, ContactRequest.builder().name("Jane Roe").build()))
                .expectNextMatches(response -> response.getName().equals("Jane Roe"))
                .verifyComplete();
    }

    @Test
    void delete_Success() {
        when(contactRepository.deleteByIdAndOwnerId(1L, ownerId)).thenReturn(Mono.just(1));

        StepVerifier.create(contactService.delete(ownerId, 1L))
                .verifyComplete();
    }
}
