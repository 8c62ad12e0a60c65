package io.fullerstack.signals.config;

import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.Set;

/**
 * Layered signal configuration backed by {@code signals.properties}.
 *
 * <p>Keys are relative to the {@code signal.} namespace. A config scoped to a signal
 * resolves each key through this chain, first hit wins:
 * <ol>
 *   <li>System property {@code signal.{name}.{key}}</li>
 *   <li>Bundle entry {@code signal.{name}.{key}}</li>
 *   <li>System property {@code signal.{key}}</li>
 *   <li>Bundle entry {@code signal.{key}}</li>
 * </ol>
 * The global config skips the first two steps.
 *
 * <p><strong>Example:</strong>
 * <pre>
 * # signals.properties
 * signal.reverse=false
 * signal.shutdown.reverse=true   # shutdown hooks run highest priority first
 * </pre>
 * <pre>
 * SignalConfig.global().reverse();                  // false
 * SignalConfig.forSignal("shutdown").reverse();     // true
 * java -Dsignal.reverse=true -jar app.jar           // flips the global default
 * </pre>
 */
public class SignalConfig {

    static final String BUNDLE = "signals";
    static final String NAMESPACE = "signal.";

    public static final String REVERSE = "reverse";

    private final ResourceBundle bundle;
    private final String signalName;  // null for global

    private SignalConfig(ResourceBundle bundle, String signalName) {
        this.bundle = bundle;
        this.signalName = signalName;
    }

    /**
     * Global configuration.
     *
     * @return config without a signal scope
     * @throws ConfigurationException if {@code signals.properties} is not on the classpath
     */
    public static SignalConfig global() {
        return new SignalConfig(loadBundle(), null);
    }

    /**
     * Configuration for one signal, falling back to global keys.
     *
     * @param signalName signal name (e.g., "user-login")
     * @return scoped config
     */
    public static SignalConfig forSignal(String signalName) {
        return global().scoped(signalName);
    }

    /**
     * Same bundle, scoped to the given signal.
     *
     * @param signalName signal name
     * @return scoped config
     */
    public SignalConfig scoped(String signalName) {
        Objects.requireNonNull(signalName, "signalName cannot be null");
        if (signalName.isBlank()) {
            throw new IllegalArgumentException("signalName cannot be blank");
        }
        return new SignalConfig(bundle, signalName);
    }

    private static ResourceBundle loadBundle() {
        try {
            return ResourceBundle.getBundle(BUNDLE, Locale.ROOT);
        } catch (MissingResourceException e) {
            throw new ConfigurationException("Missing " + BUNDLE + ".properties on classpath", e);
        }
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * Get string value.
     *
     * @param key key relative to {@code signal.}
     * @return resolved value
     * @throws ConfigurationException if key not found at any level
     */
    public String getString(String key) {
        String value = resolve(key);
        if (value == null) {
            throw new ConfigurationException(
                "Missing config key '" + NAMESPACE + key + "' in context: " + context()
            );
        }
        return value;
    }

    /**
     * Get string value with default.
     *
     * @param key          key relative to {@code signal.}
     * @param defaultValue default if not found
     * @return resolved value or default
     */
    public String getString(String key, String defaultValue) {
        String value = resolve(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get boolean value. Only {@code true} and {@code false} (any case) are accepted.
     *
     * @param key key relative to {@code signal.}
     * @return resolved value
     * @throws ConfigurationException if key not found or not a boolean
     */
    public boolean getBoolean(String key) {
        return parseBoolean(key, getString(key));
    }

    /**
     * Get boolean value with default.
     *
     * @param key          key relative to {@code signal.}
     * @param defaultValue default if not found
     * @return resolved value or default
     * @throws ConfigurationException if present but not a boolean
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = resolve(key);
        return value != null ? parseBoolean(key, value) : defaultValue;
    }

    /**
     * Whether signals created from this config run larger priorities first.
     *
     * @return resolved {@code reverse} flag, false if unset
     */
    public boolean reverse() {
        return getBoolean(REVERSE, false);
    }

    /**
     * Check if key resolves at any level.
     *
     * @param key key relative to {@code signal.}
     * @return true if present
     */
    public boolean contains(String key) {
        return resolve(key) != null;
    }

    /**
     * @return all keys in the underlying bundle
     */
    public Set<String> keys() {
        return bundle.keySet();
    }

    /**
     * @return "global" or "signal:{name}"
     */
    public String context() {
        return signalName == null ? "global" : "signal:" + signalName;
    }

    private String resolve(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (signalName != null) {
            String scoped = lookup(NAMESPACE + signalName + "." + key);
            if (scoped != null) {
                return scoped;
            }
        }
        return lookup(NAMESPACE + key);
    }

    private String lookup(String fullKey) {
        String sysProp = System.getProperty(fullKey);
        if (sysProp != null) {
            return sysProp;
        }
        return bundle.containsKey(fullKey) ? bundle.getString(fullKey) : null;
    }

    private static boolean parseBoolean(String key, String value) {
        String trimmed = value.trim();
        if ("true".equalsIgnoreCase(trimmed)) {
            return true;
        }
        if ("false".equalsIgnoreCase(trimmed)) {
            return false;
        }
        throw new ConfigurationException(
            "Invalid boolean value for key '" + NAMESPACE + key + "': " + value
        );
    }

    @Override
    public String toString() {
        return "SignalConfig[context=" + context() + "]";
    }
}
