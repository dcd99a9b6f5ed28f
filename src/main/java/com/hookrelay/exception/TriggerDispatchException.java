package com.hookrelay.exception;

/**
 * One downstream trigger call failed. Never reaches the caller on its own:
 * TriggerDispatcher records it against the attempt and keeps going.
 */
public class TriggerDispatchException extends RuntimeException {

    public static final String PREFIX = "Failed to Trigger the Build: ";

    public TriggerDispatchException(String reason) {
        super(PREFIX + reason);
    }

    public TriggerDispatchException(String reason, Throwable cause) {
        super(PREFIX + reason, cause);
    }
}
