package com.hookrelay.exception;

/** Valid payload, but nothing in it maps to a build. */
public class NoEventDetectedException extends HookRejectedException {

    public static final String MESSAGE =
            "After processing the webhook we failed to detect any event in it which could be turned into a build.";

    public NoEventDetectedException() {
        super(MESSAGE);
    }
}
