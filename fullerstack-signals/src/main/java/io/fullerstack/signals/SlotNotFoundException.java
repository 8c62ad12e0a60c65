package io.fullerstack.signals;

/**
 * Thrown when a slot identity is not registered with a signal.
 *
 * @see Signal#require(long)
 */
public class SlotNotFoundException extends SignalException {

    private final long identity;

    public SlotNotFoundException(String signalName, long identity) {
        super("Slot " + identity + " not found in signal '" + signalName + "'");
        this.identity = identity;
    }

    /**
     * @return the identity that was looked up
     */
    public long identity() {
        return identity;
    }
}
