package com.resumecontrol.util;

import com.resumecontrol.exception.InvalidArgumentException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Boundary validation for request fields.
 */
public final class Fields {

    private Fields() {
    }

    /**
     * Stripped value, or {@link InvalidArgumentException} when blank.
     */
    public static String requireText(String value, String field) {
        String trimmed = optionalText(value);
        if (trimmed == null) {
            throw new InvalidArgumentException(field, field + " is required");
        }
        return trimmed;
    }

    /**
     * Value without surrounding white space, or {@code null} when absent or
     * blank. Blank uses the same white-space set as {@link NameNormalizer}.
     */
    public static String optionalText(String value) {
        if (value == null) {
            return null;
        }
        int start = 0;
        int end = value.length();
        while (start < end && NameNormalizer.isSpace(value.codePointAt(start))) {
            start += Character.charCount(value.codePointAt(start));
        }
        while (end > start && NameNormalizer.isSpace(value.codePointBefore(end))) {
            end -= Character.charCount(value.codePointBefore(end));
        }
        return start == end ? null : value.substring(start, end);
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new InvalidArgumentException(field, field + " is required");
        }
        return value;
    }

    /**
     * Parse an ISO calendar date ({@code YYYY-MM-DD}).
     */
    public static LocalDate requireDate(String value, String field) {
        String text = requireText(value, field);
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidArgumentException(field, field + " must be in YYYY-MM-DD format (e.g., 2024-01-15)");
        }
    }
}
