package io.fullerstack.signals;

/**
 * Target invoked when a {@link Signal} dispatches to a {@link Slot}.
 *
 * <p>The handler receives the sender passed to {@link Signal#call(Object)}, which is
 * either {@link Any#ANY} or an application value. Its return value is collected into
 * the {@link DispatchResult}.
 *
 * <p>Any exception thrown by a handler stops the dispatch and reaches the caller of
 * {@code call}, except {@link HaltDispatchException}, which ends the dispatch early
 * without an error.
 *
 * @param <R> result type produced by the handler
 */
@FunctionalInterface
public interface SlotHandler<R> {

    /**
     * Handles one dispatch.
     *
     * @param sender the sender the signal was raised with
     * @return a result for this dispatch, may be null
     */
    R handle(Object sender);
}
