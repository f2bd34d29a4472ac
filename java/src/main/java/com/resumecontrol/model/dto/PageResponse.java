package com.resumecontrol.model.dto;

import com.resumecontrol.util.PageBounds;
import com.resumecontrol.util.PaginationPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of items plus pagination metadata.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PageResponse<T> {
    private List<T> data;
    private PaginationMeta meta;

    public static <T> PageResponse<T> of(List<T> data, PageBounds bounds, long totalCount) {
        PaginationMeta meta = PaginationMeta.builder()
                .page(bounds.getPage())
                .limit(bounds.getLimit())
                .totalCount(totalCount)
                .totalPages(PaginationPolicy.totalPages(totalCount, bounds.getLimit()))
                .build();
        return new PageResponse<>(data, meta);
    }
}
