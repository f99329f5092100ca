package com.kreasipositif.cashbook.domain;

import java.util.Optional;
import java.util.function.Function;

/**
 * Result of turning one input row into a value: accepted, ignored on purpose, or rejected
 * with a reason the user should see.
 */
public record RowOutcome<T>(Status status, T value, String reason) {

    public enum Status {
        /** Produced a value. */
        ACCEPTED,
        /** Skipped silently: the row carries nothing for the ledger (unknown code, zero total). */
        IGNORED,
        /** Skipped with a warning. */
        REJECTED
    }

    public static <T> RowOutcome<T> accepted(T value) {
        return new RowOutcome<>(Status.ACCEPTED, value, null);
    }

    public static <T> RowOutcome<T> ignored(String reason) {
        return new RowOutcome<>(Status.IGNORED, null, reason);
    }

    public static <T> RowOutcome<T> rejected(String reason) {
        return new RowOutcome<>(Status.REJECTED, null, reason);
    }

    public boolean isAccepted() {
        return status == Status.ACCEPTED;
    }

    /**
     * Continues with {@code next} when accepted; ignored and rejected outcomes pass through unchanged.
     */
    public <U> RowOutcome<U> flatMap(Function<T, RowOutcome<U>> next) {
        return isAccepted() ? next.apply(value) : new RowOutcome<>(status, null, reason);
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }
}
