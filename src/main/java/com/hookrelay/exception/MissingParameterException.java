package com.hookrelay.exception;

/** A required caller-supplied value (service id, app slug, API token) is absent. */
public class MissingParameterException extends HookRejectedException {

    public MissingParameterException(String message) {
        super(message);
    }
}
