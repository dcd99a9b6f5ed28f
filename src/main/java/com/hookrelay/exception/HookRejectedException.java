package com.hookrelay.exception;

import lombok.Getter;

import java.util.List;

/**
 * Base for every reason a webhook is turned down with a client error.
 * Carries the error list that goes back to the caller verbatim.
 */
@Getter
public class HookRejectedException extends RuntimeException {

    private final List<String> errors;

    public HookRejectedException(String message) {
        super(message);
        this.errors = List.of(message);
    }

    public HookRejectedException(String message, Throwable cause) {
        super(message, cause);
        this.errors = List.of(message);
    }
}
