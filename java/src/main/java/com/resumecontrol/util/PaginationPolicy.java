package com.resumecontrol.util;

/**
 * Converts untrusted page/limit parameters into bounded, deterministic values.
 *
 * Never rejects input: non-numeric or non-positive values fall back to the
 * defaults and limits above {@link #MAX_LIMIT} are clamped.
 */
public final class PaginationPolicy {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    private PaginationPolicy() {
    }

    /**
     * Resolve raw query-string values.
     *
     * @param page  raw {@code page} parameter, may be null
     * @param limit raw {@code limit} parameter, may be null
     * @return effective bounds
     */
    public static PageBounds resolve(String page, String limit) {
        return resolve(parse(page), parse(limit));
    }

    public static PageBounds resolve(Integer page, Integer limit) {
        int effectivePage = page != null && page > 0 ? page : DEFAULT_PAGE;
        int effectiveLimit = limit != null && limit > 0 ? Math.min(limit, MAX_LIMIT) : DEFAULT_LIMIT;
        return new PageBounds(effectivePage, effectiveLimit);
    }

    public static PageBounds defaults() {
        return new PageBounds(DEFAULT_PAGE, DEFAULT_LIMIT);
    }

    /**
     * Row offset of a page, floored at 0.
     */
    public static long offset(int page, int limit) {
        int effectivePage = Math.max(page, 1);
        return (long) (effectivePage - 1) * limit;
    }

    /**
     * Number of pages needed for {@code totalCount} rows. A non-positive limit counts as one page.
     */
    public static int totalPages(long totalCount, int limit) {
        if (limit <= 0) {
            return 1;
        }
        return (int) ((totalCount + limit - 1) / limit);
    }

    private static Integer parse(String value) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            // malformed values fall back to the default
            return null;
        }
    }
}
