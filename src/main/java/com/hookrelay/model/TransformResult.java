package com.hookrelay.model;

import com.hookrelay.dto.TriggerParams;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * What a provider made of one inbound webhook.
 *
 * Exactly one of three shapes:
 *   skip     → recognized event that needs no build, acknowledged as success
 *   error    → malformed or unsupported payload, rejected as a client error
 *   triggers → zero or more builds to start (zero is rejected later as "no event")
 *
 * Only the factory methods create instances, so a result can never be a skip
 * and an error at the same time. Equality is structural.
 */
@Getter
@EqualsAndHashCode
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class TransformResult {

    private final boolean shouldSkip;
    private final String skipReason;
    private final String error;
    private final List<TriggerParams> triggerParams;

    public static TransformResult skip(String reason) {
        return new TransformResult(true, reason, null, List.of());
    }

    public static TransformResult error(String message) {
        return new TransformResult(false, null, message, List.of());
    }

    public static TransformResult triggers(List<TriggerParams> params) {
        return new TransformResult(false, null, null, List.copyOf(params));
    }

    public static TransformResult trigger(TriggerParams params) {
        return triggers(List.of(params));
    }

    public boolean hasError() {
        return error != null;
    }
}
