package com.resumecontrol.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or updating an application.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApplicationRequest {

    @NotBlank(message = "Status is required")
    private String status;

    /** ISO date, {@code YYYY-MM-DD}. */
    @NotBlank(message = "Applied date is required")
    private String appliedDate;

    private Long contactId;

    private String notes;
}
