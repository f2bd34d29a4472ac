package com.resumecontrol.model.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or updating a job.
 *
 * {@code applicationId} is required on create and ignored on update; a job
 * never moves to another application. {@code companyId} is required on create
 * and optional on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class JobRequest {

    private Long applicationId;

    private Long companyId;

    @NotBlank(message = "Job title is required")
    @Size(max = 255, message = "Job title must be at most 255 characters")
    private String title;

    private String description;
    private String requirements;

    @Size(max = 255, message = "Location must be at most 255 characters")
    private String location;
}
