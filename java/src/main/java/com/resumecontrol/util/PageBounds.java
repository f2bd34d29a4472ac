package com.resumecontrol.util;

import lombok.Value;

/**
 * Effective page and limit after {@link PaginationPolicy} has applied defaults and the cap.
 */
@Value
public class PageBounds {

    int page;
    int limit;

    public long getOffset() {
        return PaginationPolicy.offset(page, limit);
    }
}
