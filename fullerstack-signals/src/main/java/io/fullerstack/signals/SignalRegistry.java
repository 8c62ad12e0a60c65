package io.fullerstack.signals;

import io.fullerstack.signals.config.SignalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Name-keyed registry of shared signals.
 *
 * <p>Every lookup of the same name returns the same {@link Signal}, so independent
 * components can register slots on, and raise, a signal without passing it around.
 * A signal that should not be shared is simply created with {@code new Signal<>(name)}.
 *
 * <p>New signals take their ordering direction from {@link SignalConfig}:
 * <pre>
 * # signals.properties
 * signal.shutdown.reverse=true
 *
 * Signal&lt;Void&gt; shutdown = SignalRegistry.global().signal("shutdown");  // reversed
 * </pre>
 *
 * <p><b>Thread safety:</b> get-or-create is atomic per name; concurrent callers
 * asking for the same name observe one instance.
 */
public final class SignalRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SignalRegistry.class);

    private static final class Holder {
        static final SignalRegistry GLOBAL = new SignalRegistry(SignalConfig.global());
    }

    private final ConcurrentMap<String, Signal<?>> signals = new ConcurrentHashMap<>();
    private final SignalConfig config;

    /**
     * Creates an isolated registry.
     *
     * @param config source of per-signal defaults
     */
    public SignalRegistry(SignalConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    /**
     * @return the process-wide registry, configured from {@code signals.properties}
     */
    public static SignalRegistry global() {
        return Holder.GLOBAL;
    }

    /**
     * Gets or creates the signal with this name. A new signal's direction comes from
     * configuration.
     *
     * @param name signal name
     * @param <R>  handler result type
     * @return the shared signal
     */
    @SuppressWarnings("unchecked")
    public <R> Signal<R> signal(String name) {
        requireName(name);
        return (Signal<R>) signals.computeIfAbsent(name, key -> create(key, config.scoped(key).reverse()));
    }

    /**
     * Gets or creates the signal with this name and direction.
     *
     * @param name    signal name
     * @param reverse true if larger priorities run first
     * @param <R>     handler result type
     * @return the shared signal
     * @throws IllegalArgumentException if the signal exists with the other direction
     */
    @SuppressWarnings("unchecked")
    public <R> Signal<R> signal(String name, boolean reverse) {
        requireName(name);
        Signal<?> signal = signals.computeIfAbsent(name, key -> create(key, reverse));
        if (signal.reverse() != reverse) {
            throw new IllegalArgumentException(
                "Signal '" + name + "' already exists with reverse=" + signal.reverse()
            );
        }
        return (Signal<R>) signal;
    }

    /**
     * @param name signal name
     * @return the signal if it has been created
     */
    public Optional<Signal<?>> find(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        return Optional.ofNullable(signals.get(name));
    }

    /**
     * Forgets a signal. Holders of the instance keep using it, but the next lookup of
     * the name creates a fresh signal.
     *
     * @param name signal name
     * @return true if a signal was removed
     */
    public boolean remove(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        Signal<?> removed = signals.remove(name);
        if (removed != null) {
            logger.debug("Removed {}", removed);
        }
        return removed != null;
    }

    /**
     * @return names of all registered signals
     */
    public Set<String> names() {
        return Collections.unmodifiableSet(signals.keySet());
    }

    public int size() {
        return signals.size();
    }

    private Signal<?> create(String name, boolean reverse) {
        Signal<?> signal = new Signal<>(name, reverse);
        logger.debug("Created {}", signal);
        return signal;
    }

    private static void requireName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name cannot be blank");
        }
    }

    @Override
    public String toString() {
        return "SignalRegistry[signals=" + signals.size() + ", config=" + config.context() + "]";
    }
}
