package io.herald.core.registry;

/** Raised by a {@link PeriodicExecutor} that can no longer accept or change schedules. */
public final class SchedulingUnavailableException extends Exception {

    public SchedulingUnavailableException(String message) {
        super(message);
    }

    public SchedulingUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
