package io.fullerstack.signals;

/**
 * Thrown by a {@link SlotHandler} to stop the current dispatch.
 *
 * <p>This is a control-flow signal, not a failure: {@link Signal#call(Object)} catches
 * it, skips the remaining slots and returns a {@link DispatchResult} with status
 * {@link DispatchResult.Status#HALTED}. No stack trace is captured.
 */
public class HaltDispatchException extends SignalException {

    public HaltDispatchException() {
        this("Dispatch halted");
    }

    public HaltDispatchException(String message) {
        super(message);
    }

    @Override
    public synchronized Throwable fillInStackTrace() {
        return this;
    }
}
