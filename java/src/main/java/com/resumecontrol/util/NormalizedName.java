package com.resumecontrol.util;

import lombok.Value;

/**
 * Canonical forms of a free-text name.
 */
@Value
public class NormalizedName {

    /** Form that is stored and shown, e.g. {@code "Acme Corp"}. */
    String display;

    /** Form used only for equality and uniqueness, e.g. {@code "acme corp"}. */
    String key;

    public boolean isEmpty() {
        return display.isEmpty();
    }
}
