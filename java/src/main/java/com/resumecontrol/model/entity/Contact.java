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
 * Contact entity (recruiter, referrer, hiring manager).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("contacts")
public class Contact {

    @Id
    private Long id;

    @Column("owner_id")
    private UUID ownerId;

    @Column("name")
    private String name;

    @Column("email")
    private String email;

    @Column("phone")
    private String phone;

    @Column("linkedin")
    private String linkedin;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
