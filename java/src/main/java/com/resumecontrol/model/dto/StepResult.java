package com.resumecontrol.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one step of a multi-step update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StepResult {

    public static final String OK = "ok";
    public static final String FAILED = "failed";

    private String step;
    private String status;
    private String detail;
}
