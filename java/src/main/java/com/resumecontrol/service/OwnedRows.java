package com.resumecontrol.service;

import com.resumecontrol.exception.InvalidArgumentException;
import com.resumecontrol.exception.ResourceInUseException;
import com.resumecontrol.exception.ResourceNotFoundException;
import com.resumecontrol.exception.StoreErrors;
import com.resumecontrol.exception.StoreException;
import com.resumecontrol.model.dto.PageResponse;
import com.resumecontrol.util.PageBounds;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.function.Supplier;

/**
 * Helpers shared by the owner-scoped services.
 */
final class OwnedRows {

    private OwnedRows() {
    }

    static <T> Mono<T> required(Mono<T> row, String resource, Object id) {
        return row.switchIfEmpty(Mono.error(() -> new ResourceNotFoundException(resource, id)))
                .onErrorMap(StoreErrors::isStoreFailure, e -> failure("fetch " + resource, e));
    }

    /**
     * Count, then fetch only when the page offset is inside the result set.
     */
    static <T> Mono<PageResponse<T>> page(String resource, PageBounds bounds, Mono<Long> count,
                                          Supplier<Flux<T>> fetch) {
        return count.defaultIfEmpty(0L)
                .flatMap(total -> {
                    if (bounds.getOffset() >= total) {
                        return Mono.just(PageResponse.<T>of(Collections.emptyList(), bounds, total));
                    }
                    return fetch.get()
                            .collectList()
                            .map(items -> PageResponse.of(items, bounds, total));
                })
                .onErrorMap(StoreErrors::isStoreFailure, e -> failure("list " + resource, e));
    }

    /**
     * Completes when one row was affected, {@link ResourceNotFoundException} when none was.
     */
    static Mono<Void> affected(Mono<Integer> rows, String resource, Object id) {
        return rows.defaultIfEmpty(0)
                .flatMap(count -> count > 0
                        ? Mono.<Void>empty()
                        : Mono.<Void>error(new ResourceNotFoundException(resource, id)));
    }

    /**
     * Owner-scoped delete. A foreign key that blocks it becomes {@link ResourceInUseException}.
     */
    static Mono<Void> deleted(Mono<Integer> rows, String resource, Long id) {
        return affected(rows, resource, id)
                .onErrorMap(StoreErrors::isReferenceViolation, e -> new ResourceInUseException(resource, id, e))
                .onErrorMap(StoreErrors::isStoreFailure, e -> failure("delete " + resource, e));
    }

    /**
     * A value longer than its column is the caller's fault; anything else is internal.
     */
    static RuntimeException failure(String action, Throwable cause) {
        if (StoreErrors.isValueTooLong(cause)) {
            return new InvalidArgumentException("value", "A value exceeds the maximum allowed length");
        }
        return new StoreException("Failed to " + action, cause);
    }
}
