package com.hookrelay.model;

import lombok.Value;

import java.util.List;

/**
 * Client-facing verdict for one webhook: accepted with a message, or rejected
 * with a non-empty error list.
 */
@Value
public class HookOutcome {

    boolean accepted;
    String message;
    List<String> errors;

    public static HookOutcome accepted(String message) {
        return new HookOutcome(true, message, List.of());
    }

    public static HookOutcome rejected(List<String> errors) {
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("A rejection needs at least one error");
        }
        return new HookOutcome(false, null, List.copyOf(errors));
    }

    public static HookOutcome rejected(String error) {
        return rejected(List.of(error));
    }
}
