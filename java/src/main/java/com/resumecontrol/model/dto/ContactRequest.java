package com.resumecontrol.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or updating a contact.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContactRequest {

    @NotBlank(message = "Contact name is required")
    @Size(max = 255, message = "Contact name must be at most 255 characters")
    private String name;

    @Size(max = 255, message = "Email must be at most 255 characters")
    private String email;

    @Size(max = 64, message = "Phone must be at most 64 characters")
    private String phone;

    @Size(max = 512, message = "LinkedIn URL must be at most 512 characters")
    private String linkedin;
}
