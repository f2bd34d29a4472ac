package com.resumecontrol.service;

import lombok.Value;

import java.util.function.Function;

/**
 * Result of a get-or-create: the resource, and whether it already existed.
 */
@Value
public class CreateOutcome<T> {

    T resource;
    boolean existed;

    public static <T> CreateOutcome<T> created(T resource) {
        return new CreateOutcome<>(resource, false);
    }

    public static <T> CreateOutcome<T> existing(T resource) {
        return new CreateOutcome<>(resource, true);
    }

    public <R> CreateOutcome<R> map(Function<? super T, ? extends R> mapper) {
        return new CreateOutcome<>(mapper.apply(resource), existed);
    }
}
