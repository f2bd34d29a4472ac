package com.resumecontrol.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Application entity. {@code status} holds the wire value of an {@link ApplicationStatus}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("applications")
public class Application {

    @Id
    private Long id;

    @Column("owner_id")
    private UUID ownerId;

    @Column("status")
    private String status;

    @Column("applied_date")
    private LocalDate appliedDate;

    @Column("contact_id")
    private Long contactId;

    @Column("notes")
    private String notes;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
