package io.fullerstack.signals;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Comparator;
import java.util.Objects;

/**
 * One registration in a {@link Signal}: a handler, the listener it filters on, its
 * priority and the identity assigned when it was added.
 *
 * <p>Slots are immutable and only created by {@link Signal#add(SlotHandler, int, Object)}.
 * The identity is unique within the owning signal and never reused, so it can be kept
 * and later passed to {@link Signal#delete(long)} or {@link Signal#find(long)}.
 *
 * <p>Natural order is priority ascending, then identity ascending. Equality is instance
 * identity: every {@code add} produces a distinct slot.
 *
 * @param <R> result type of the handler
 */
@Getter
@Accessors(fluent = true)
public final class Slot<R> implements Comparable<Slot<?>> {

    /**
     * Ascending priority, ties by identity. Used by signals that run small priorities first.
     */
    static final Comparator<Slot<?>> ASCENDING =
        Comparator.<Slot<?>>comparingInt(Slot::priority).thenComparingLong(Slot::identity);

    /**
     * Descending priority, ties still by ascending identity. Used by reversed signals.
     */
    static final Comparator<Slot<?>> DESCENDING =
        Comparator.<Slot<?>>comparingInt(Slot::priority).reversed().thenComparingLong(Slot::identity);

    private final Signal<R> signal;
    private final long identity;
    private final int priority;
    private final SlotHandler<R> handler;
    private final Object listener;

    Slot(Signal<R> signal, long identity, int priority, SlotHandler<R> handler, Object listener) {
        this.signal = Objects.requireNonNull(signal, "signal cannot be null");
        this.identity = identity;
        this.priority = priority;
        this.handler = Objects.requireNonNull(handler, "handler cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
    }

    /**
     * Returns the dispatch order for a signal.
     *
     * @param reverse true if larger priorities run first
     * @return comparator over (priority, identity)
     */
    static Comparator<Slot<?>> order(boolean reverse) {
        return reverse ? DESCENDING : ASCENDING;
    }

    /**
     * Dispatch-time match: either side being {@link Any#ANY} matches, otherwise
     * the listener must equal the sender.
     *
     * @param sender sender of the current dispatch
     * @return true if this slot should be invoked
     */
    public boolean matches(Object sender) {
        return Any.isAny(listener) || Any.isAny(sender) || listener.equals(sender);
    }

    /**
     * Invokes the handler with the given sender.
     *
     * @param sender sender of the current dispatch
     * @return the handler's result
     */
    public R invoke(Object sender) {
        return handler.handle(sender);
    }

    @Override
    public int compareTo(Slot<?> other) {
        return ASCENDING.compare(this, other);
    }

    @Override
    public String toString() {
        return "Slot[identity=" + identity
            + ", priority=" + priority
            + ", listener=" + listener
            + ", signal=" + signal.name() + "]";
    }
}
