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
 * Company entity.
 *
 * {@code nameKey} is the comparison key of {@code name}; the store declares
 * {@code UNIQUE (owner_id, name_key)} so equivalent names collide per owner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("companies")
public class Company {

    @Id
    private Long id;

    @Column("owner_id")
    private UUID ownerId;

    @Column("name")
    private String name;

    @Column("name_key")
    private String nameKey;

    @Column("website")
    private String website;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;
}
