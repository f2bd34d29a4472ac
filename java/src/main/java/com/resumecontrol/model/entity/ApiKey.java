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
 * Bearer credential of one owner. The secret itself is never stored; the hint
 * is its first characters so the owner can tell keys apart.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKey {

    @Id
    private UUID id;

    @Column("owner_id")
    private UUID ownerId;

    @Column("secret_digest")
    private String secretDigest;

    @Column("hint")
    private String hint;

    @Column("issued_at")
    private LocalDateTime issuedAt;

    @Column("last_used_at")
    private LocalDateTime lastUsedAt;
}
