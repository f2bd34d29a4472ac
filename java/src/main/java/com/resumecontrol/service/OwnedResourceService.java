package com.resumecontrol.service;

import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.util.PageBounds;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Operations shared by every owner-scoped resource.
 *
 * A row that exists but belongs to another owner is reported exactly like a
 * missing row.
 *
 * @param <T> response type
 * @param <R> request type
 */
public interface OwnedResourceService<T, R> {

    Mono<PageResponse<T>> list(UUID ownerId, PageBounds bounds);

    Mono<T> get(UUID ownerId, Long id);

    Mono<T> update(UUID ownerId, Long id, R request);

    Mono<Void> delete(UUID ownerId, Long id);
}
