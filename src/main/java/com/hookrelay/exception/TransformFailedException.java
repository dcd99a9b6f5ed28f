package com.hookrelay.exception;

/** The provider could not make sense of the payload. */
public class TransformFailedException extends HookRejectedException {

    public TransformFailedException(String transformError) {
        super("Failed to transform the webhook: " + transformError);
    }

    public TransformFailedException(String transformError, Throwable cause) {
        super("Failed to transform the webhook: " + transformError, cause);
    }
}
