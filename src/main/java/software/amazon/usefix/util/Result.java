/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.usefix.util;

import java.util.Objects;

/**
 * Type representing the outcome of an operation that either produces a value
 * or a description of why it couldn't. Exactly one of the two is present.
 *
 * @param <T> Type of successful result
 * @param <E> Type of failed result
 */
public final class Result<T, E> {
    private final T value;
    private final E error;

    private Result(T value, E error) {
        this.value = value;
        this.error = error;
    }

    /**
     * @param value The success value
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The successful result
     */
    public static <T, E> Result<T, E> ok(T value) {
        return new Result<>(Objects.requireNonNull(value), null);
    }

    /**
     * @param error The failed value
     * @param <T> Type of successful result
     * @param <E> Type of failed result
     * @return The failed result
     */
    public static <T, E> Result<T, E> err(E error) {
        return new Result<>(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return value != null;
    }

    public boolean isErr() {
        return error != null;
    }

    /**
     * @return The successful value
     * @throws IllegalStateException If this result failed
     */
    public T unwrap() {
        if (value == null) {
            throw new IllegalStateException("Called unwrap on a failed Result: " + error);
        }
        return value;
    }

    /**
     * @return The failed value
     * @throws IllegalStateException If this result succeeded
     */
    public E unwrapErr() {
        if (error == null) {
            throw new IllegalStateException("Called unwrapErr on a successful Result: " + value);
        }
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "Ok(" + value + ")" : "Err(" + error + ")";
    }
}
