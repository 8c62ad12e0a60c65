package io.fullerstack.signals;

/**
 * Wildcard sentinel for listeners and senders.
 *
 * <p>A slot registered with {@link #ANY} as its listener receives every dispatch,
 * and a dispatch raised with {@link #ANY} as its sender reaches every slot.
 * Lookups are different: {@link Signal#findByListener(Object)} compares listeners
 * exactly, so searching for {@code ANY} only returns slots registered with {@code ANY}.
 *
 * <p>An enum singleton carries no mutable state and is safe to share and compare
 * across threads.
 */
public enum Any {
    ANY;

    /**
     * Checks whether the given value is the wildcard sentinel.
     *
     * @param value value to test
     * @return true if value is {@link #ANY}
     */
    public static boolean isAny(Object value) {
        return value == ANY;
    }
}
