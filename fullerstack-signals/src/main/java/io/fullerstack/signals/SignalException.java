package io.fullerstack.signals;

/**
 * Base class for all exceptions raised by signals and slots.
 */
public class SignalException extends RuntimeException {

    public SignalException(String message) {
        super(message);
    }

    public SignalException(String message, Throwable cause) {
        super(message, cause);
    }
}
