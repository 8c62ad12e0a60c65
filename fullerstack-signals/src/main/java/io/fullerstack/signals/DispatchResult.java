package io.fullerstack.signals;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a single {@link Signal#call(Object)}.
 *
 * <p>{@code values} holds what each invoked handler returned, in invocation order;
 * entries may be null. When a handler halted the dispatch, {@code haltedBy} is that
 * slot and it contributes no value.
 *
 * @param status   how the dispatch ended
 * @param values   handler results in invocation order
 * @param haltedBy the slot that halted the dispatch, null when completed
 * @param <R>      handler result type
 */
public record DispatchResult<R>(Status status, List<R> values, Slot<R> haltedBy) {

    /**
     * How a dispatch ended.
     */
    public enum Status {
        /** Every matching slot ran. */
        COMPLETED,
        /** A handler threw {@link HaltDispatchException}. */
        HALTED
    }

    public DispatchResult {
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (status == Status.HALTED) {
            Objects.requireNonNull(haltedBy, "haltedBy cannot be null for a halted dispatch");
        } else if (haltedBy != null) {
            throw new IllegalArgumentException("haltedBy must be null for a completed dispatch");
        }
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    static <R> DispatchResult<R> complete(List<R> values) {
        return new DispatchResult<>(Status.COMPLETED, values, null);
    }

    static <R> DispatchResult<R> halt(List<R> values, Slot<R> haltedBy) {
        return new DispatchResult<>(Status.HALTED, values, haltedBy);
    }

    /**
     * @return true if every matching slot ran
     */
    public boolean completed() {
        return status == Status.COMPLETED;
    }

    /**
     * @return the halting slot, if any
     */
    public Optional<Slot<R>> halter() {
        return Optional.ofNullable(haltedBy);
    }

    /**
     * @return number of handlers that returned a value
     */
    public int invoked() {
        return values.size();
    }
}
