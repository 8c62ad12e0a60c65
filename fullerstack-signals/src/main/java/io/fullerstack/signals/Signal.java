package io.fullerstack.signals;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IntSummaryStatistics;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * A named event holding an ordered set of {@link Slot}s.
 *
 * <p>Slots are dispatched in priority order, smallest priority first unless the
 * signal is reversed. Slots with equal priority always run in the order they were
 * added, whatever the direction.
 *
 * <p><b>Usage:</b>
 * <pre>
 * Signal&lt;Void&gt; login = new Signal&lt;&gt;("user-login");
 * Slot&lt;Void&gt; audit = login.add(sender -&gt; { audit(sender); return null; }, -10);
 * login.add(sender -&gt; { greet(sender); return null; }, Signal.PRIORITY_NORMAL, "web");
 *
 * login.call("web");      // audit, then greet
 * login.call("console");  // audit only
 * login.delete(audit);
 * </pre>
 *
 * <p><b>Storage:</b>
 * <ul>
 *   <li>Slots live in an array list kept sorted by (priority, identity)</li>
 *   <li>add(): O(log n) binary search for the insertion point, O(n) splice</li>
 *   <li>delete(Slot): O(log n) search, O(n) splice; delete(long): O(n) scan</li>
 *   <li>call(): O(n) over all slots, whether or not they match the sender</li>
 * </ul>
 * Dispatch is expected to be far more frequent than registration changes, so the
 * sequence is optimised for iteration rather than insertion.
 *
 * <p><b>Thread safety:</b>
 * A ReadWriteLock guards the slot list:
 * <ul>
 *   <li>Exclusive writer: add, delete, deleteHandler, clear</li>
 *   <li>Shared readers: find, require, findByHandler, findByListener, contains</li>
 * </ul>
 * Every mutation republishes an immutable snapshot of the list before releasing the
 * write lock. {@link #call(Object)} iterates the snapshot current when it started and
 * holds no lock while handlers run, so concurrent dispatches proceed in parallel and
 * a handler may add, delete or call on the same signal. Such changes apply from the
 * next dispatch on.
 *
 * @param <R> result type produced by the slot handlers
 */
public class Signal<R> {

    private static final Logger logger = LoggerFactory.getLogger(Signal.class);

    /**
     * Priority given to slots added without one. Reversing a signal does not change it.
     */
    public static final int PRIORITY_NORMAL = 0;

    private final String name;
    private final boolean reverse;
    private final Comparator<Slot<?>> order;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** Guarded by lock, sorted by order. */
    private final List<Slot<R>> slots = new ArrayList<>();

    /** Guarded by the write lock. */
    private long nextIdentity = 0;

    /** Immutable copy of slots, replaced on every mutation. */
    private volatile List<Slot<R>> dispatchView = List.of();

    /**
     * Creates a signal that runs smaller priorities first.
     *
     * @param name informational name of the signal
     */
    public Signal(String name) {
        this(name, false);
    }

    /**
     * Creates a signal.
     *
     * @param name    informational name of the signal
     * @param reverse true if larger priorities should run first
     */
    public Signal(String name, boolean reverse) {
        Objects.requireNonNull(name, "Signal name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Signal name cannot be blank");
        }
        this.name = name;
        this.reverse = reverse;
        this.order = Slot.order(reverse);
    }

    public String name() {
        return name;
    }

    public boolean reverse() {
        return reverse;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Adds a handler with {@link #PRIORITY_NORMAL} that listens to every sender.
     *
     * @param handler the handler to invoke
     * @return the created slot
     */
    public Slot<R> add(SlotHandler<R> handler) {
        return add(handler, PRIORITY_NORMAL, Any.ANY);
    }

    /**
     * Adds a handler with the given priority that listens to every sender.
     *
     * @param handler  the handler to invoke
     * @param priority dispatch priority
     * @return the created slot
     */
    public Slot<R> add(SlotHandler<R> handler, int priority) {
        return add(handler, priority, Any.ANY);
    }

    /**
     * Adds a handler.
     *
     * @param handler  the handler to invoke
     * @param priority dispatch priority
     * @param listener the sender this slot listens to, or {@link Any#ANY}
     * @return the created slot, whose identity is unique within this signal
     * @throws NullPointerException if handler or listener is null
     */
    public Slot<R> add(SlotHandler<R> handler, int priority, Object listener) {
        Objects.requireNonNull(handler, "handler cannot be null");
        Objects.requireNonNull(listener, "listener cannot be null");

        Slot<R> slot;
        lock.writeLock().lock();
        try {
            slot = new Slot<>(this, nextIdentity++, priority, handler, listener);
            slots.add(insertionPoint(slot), slot);
            publish();
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Signal '{}': added {}", name, slot);
        return slot;
    }

    /**
     * Removes a slot.
     *
     * @param slot slot previously returned by {@link #add} on this signal
     * @return true if removed, false if it was not registered here
     */
    public boolean delete(Slot<?> slot) {
        Objects.requireNonNull(slot, "slot cannot be null");
        if (slot.signal() != this) {
            return false;
        }

        lock.writeLock().lock();
        try {
            int index = indexOf(slot);
            if (index < 0) {
                return false;
            }
            slots.remove(index);
            publish();
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Signal '{}': deleted {}", name, slot);
        return true;
    }

    /**
     * Removes the slot with the given identity.
     *
     * @param identity identity of the slot
     * @return true if removed, false if no such slot is registered
     */
    public boolean delete(long identity) {
        Slot<R> removed = null;
        lock.writeLock().lock();
        try {
            for (int i = 0; i < slots.size(); i++) {
                if (slots.get(i).identity() == identity) {
                    removed = slots.remove(i);
                    publish();
                    break;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (removed == null) {
            return false;
        }
        logger.debug("Signal '{}': deleted {}", name, removed);
        return true;
    }

    /**
     * Removes every slot registered with the given handler instance.
     *
     * @param handler the handler, compared by reference
     * @return number of slots removed
     */
    public int deleteHandler(SlotHandler<?> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");

        int removed;
        lock.writeLock().lock();
        try {
            int before = slots.size();
            slots.removeIf(slot -> slot.handler() == handler);
            removed = before - slots.size();
            if (removed > 0) {
                publish();
            }
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Signal '{}': deleted {} slot(s) for handler {}", name, removed, handler);
        return removed;
    }

    /**
     * Removes all slots. Identities are not reset.
     *
     * @return number of slots removed
     */
    public int clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = slots.size();
            slots.clear();
            publish();
        } finally {
            lock.writeLock().unlock();
        }

        logger.debug("Signal '{}': cleared {} slot(s)", name, removed);
        return removed;
    }

    // =========================================================================
    // Dispatch
    // =========================================================================

    /**
     * Dispatches to every slot, whatever its listener.
     *
     * @return the dispatch outcome
     */
    public DispatchResult<R> call() {
        return call(Any.ANY);
    }

    /**
     * Invokes every slot whose listener matches the sender, in dispatch order.
     *
     * <p>A slot matches when its listener is {@link Any#ANY}, the sender is
     * {@link Any#ANY}, or the listener equals the sender.
     *
     * <p>Exceptions thrown by a handler propagate immediately and the remaining
     * slots are skipped. A {@link HaltDispatchException} also skips the remaining
     * slots but is reported through the result instead.
     *
     * @param sender who raised the event, or {@link Any#ANY}
     * @return handler results and completion status
     */
    public DispatchResult<R> call(Object sender) {
        Objects.requireNonNull(sender, "sender cannot be null");

        List<Slot<R>> view = dispatchView;
        List<R> values = new ArrayList<>();
        for (Slot<R> slot : view) {
            if (!slot.matches(sender)) {
                continue;
            }
            try {
                values.add(slot.invoke(sender));
            } catch (HaltDispatchException halt) {
                logger.trace("Signal '{}': dispatch for {} halted by {}", name, sender, slot);
                return DispatchResult.halt(values, slot);
            }
        }

        logger.trace("Signal '{}': dispatched {} of {} slot(s) for {}", name, values.size(), view.size(), sender);
        return DispatchResult.complete(values);
    }

    // =========================================================================
    // Lookup
    // =========================================================================

    /**
     * Finds a slot by identity.
     *
     * @param identity the slot identity
     * @return the slot, or empty if not registered
     */
    public Optional<Slot<R>> find(long identity) {
        lock.readLock().lock();
        try {
            for (Slot<R> slot : slots) {
                if (slot.identity() == identity) {
                    return Optional.of(slot);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds a slot by identity, failing if absent.
     *
     * @param identity the slot identity
     * @return the slot
     * @throws SlotNotFoundException if no slot has this identity
     */
    public Slot<R> require(long identity) {
        return find(identity).orElseThrow(() -> new SlotNotFoundException(name, identity));
    }

    /**
     * Finds all slots registered with the given handler instance.
     *
     * @param handler the handler, compared by reference
     * @return matching slots in dispatch order, empty if none
     */
    public List<Slot<R>> findByHandler(SlotHandler<?> handler) {
        Objects.requireNonNull(handler, "handler cannot be null");

        lock.readLock().lock();
        try {
            List<Slot<R>> found = new ArrayList<>();
            for (Slot<R> slot : slots) {
                if (slot.handler() == handler) {
                    found.add(slot);
                }
            }
            return Collections.unmodifiableList(found);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Finds all slots registered with exactly this listener.
     *
     * <p>Unlike dispatch, {@link Any#ANY} has no wildcard meaning here: it only finds
     * slots that were registered with {@code ANY}.
     *
     * @param listener listener value to match with equals
     * @return matching slots in dispatch order, empty if none
     */
    public List<Slot<R>> findByListener(Object listener) {
        Objects.requireNonNull(listener, "listener cannot be null");

        lock.readLock().lock();
        try {
            List<Slot<R>> found = new ArrayList<>();
            for (Slot<R> slot : slots) {
                if (slot.listener().equals(listener)) {
                    found.add(slot);
                }
            }
            return Collections.unmodifiableList(found);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @param slot a slot
     * @return true if the slot is currently registered with this signal
     */
    public boolean contains(Slot<?> slot) {
        if (slot == null || slot.signal() != this) {
            return false;
        }
        lock.readLock().lock();
        try {
            return indexOf(slot) >= 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return immutable snapshot of all slots in dispatch order
     */
    public List<Slot<R>> slots() {
        return dispatchView;
    }

    public int size() {
        return dispatchView.size();
    }

    public boolean isEmpty() {
        return dispatchView.isEmpty();
    }

    // =========================================================================
    // Priority helpers
    // =========================================================================

    /**
     * Returns a priority that runs one step before the given slots, or before every
     * registered slot when none are given.
     *
     * @param reference slots to run before
     * @return the priority, or {@link #PRIORITY_NORMAL} if there are no slots
     */
    public int priorityAbove(Slot<?>... reference) {
        return priorityAbove(1, reference);
    }

    /**
     * Returns a priority that runs {@code boost} steps before the given slots, or
     * before every registered slot when none are given.
     *
     * @param boost     distance from the nearest reference priority, must be positive
     * @param reference slots to run before
     * @return the priority, or {@link #PRIORITY_NORMAL} if there are no slots
     */
    public int priorityAbove(int boost, Slot<?>... reference) {
        IntSummaryStatistics stats = priorities(boost, reference);
        if (stats.getCount() == 0) {
            return PRIORITY_NORMAL;
        }
        return reverse
            ? Math.addExact(stats.getMax(), boost)
            : Math.subtractExact(stats.getMin(), boost);
    }

    /**
     * Returns a priority that runs one step after the given slots, or after every
     * registered slot when none are given.
     *
     * @param reference slots to run after
     * @return the priority, or {@link #PRIORITY_NORMAL} if there are no slots
     */
    public int priorityBelow(Slot<?>... reference) {
        return priorityBelow(1, reference);
    }

    /**
     * Returns a priority that runs {@code boost} steps after the given slots, or
     * after every registered slot when none are given.
     *
     * @param boost     distance from the nearest reference priority, must be positive
     * @param reference slots to run after
     * @return the priority, or {@link #PRIORITY_NORMAL} if there are no slots
     */
    public int priorityBelow(int boost, Slot<?>... reference) {
        IntSummaryStatistics stats = priorities(boost, reference);
        if (stats.getCount() == 0) {
            return PRIORITY_NORMAL;
        }
        return reverse
            ? Math.subtractExact(stats.getMin(), boost)
            : Math.addExact(stats.getMax(), boost);
    }

    private IntSummaryStatistics priorities(int boost, Slot<?>[] reference) {
        if (boost <= 0) {
            throw new IllegalArgumentException("boost must be positive: " + boost);
        }
        IntSummaryStatistics stats = new IntSummaryStatistics();
        if (reference == null || reference.length == 0) {
            dispatchView.forEach(slot -> stats.accept(slot.priority()));
        } else {
            for (Slot<?> slot : reference) {
                stats.accept(Objects.requireNonNull(slot, "reference slot cannot be null").priority());
            }
        }
        return stats;
    }

    // =========================================================================
    // Internals (caller holds the lock)
    // =========================================================================

    /**
     * First index whose slot sorts after the given one.
     */
    private int insertionPoint(Slot<?> slot) {
        int low = 0;
        int high = slots.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (order.compare(slots.get(mid), slot) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private int indexOf(Slot<?> slot) {
        int index = insertionPoint(slot);
        if (index < slots.size() && slots.get(index) == slot) {
            return index;
        }
        return -1;
    }

    private void publish() {
        dispatchView = List.copyOf(slots);
    }

    @Override
    public String toString() {
        return "Signal[name=" + name + ", reverse=" + reverse + ", slots=" + dispatchView.size() + "]";
    }
}
