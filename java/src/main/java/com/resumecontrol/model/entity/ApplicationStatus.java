package com.resumecontrol.model.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fixed set of application states. Stored and exchanged as the lowercase value.
 */
public enum ApplicationStatus {
    APPLIED("applied"),
    INTERVIEW("interview"),
    OFFER("offer"),
    REJECTED("rejected"),
    WITHDRAWN("withdrawn"),
    ACCEPTED("accepted");

    private final String value;

    ApplicationStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Look up a status by its wire value. Matching is exact after trimming.
     */
    public static Optional<ApplicationStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        return Arrays.stream(values())
                .filter(status -> status.value.equals(trimmed))
                .findFirst();
    }
}
