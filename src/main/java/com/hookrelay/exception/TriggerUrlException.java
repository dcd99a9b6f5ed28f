package com.hookrelay.exception;

public class TriggerUrlException extends HookRejectedException {

    public TriggerUrlException(String reason, Throwable cause) {
        super("Failed to create Build Trigger URL: " + reason, cause);
    }
}
