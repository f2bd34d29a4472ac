package com.resumecontrol.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Job entity. Belongs to exactly one application.
 *
 * {@code ownerId} is copied from the parent application at write time and
 * must always equal it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("jobs")
public class Job {

    @Id
    private Long id;

    @Column("owner_id")
    private UUID ownerId;

    @Column("application_id")
    private Long applicationId;

    @Column("company_id")
    private Long companyId;

    @Column("title")
    private String title;

    @Column("description")
    private String description;

    @Column("requirements")
    private String requirements;

    @Column("location")
    private String location;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
