package com.hookrelay.model;

import lombok.Value;

import java.util.List;
import java.util.stream.Stream;

/**
 * Aggregate of a fan-out: how many triggers were attempted, one outcome per
 * attempt in input order, and any errors that were not tied to an attempt
 * (the "no event detected" case).
 */
@Value
public class DispatchReport {

    int attempted;
    List<DispatchOutcome> outcomes;
    List<String> batchErrors;

    public static DispatchReport of(List<DispatchOutcome> outcomes) {
        return new DispatchReport(outcomes.size(), List.copyOf(outcomes), List.of());
    }

    public static DispatchReport noAttempt(String error) {
        return new DispatchReport(0, List.of(), List.of(error));
    }

    /** Batch errors first, then one entry per failed attempt. */
    public List<String> errors() {
        List<String> failed = outcomes.stream()
                .filter(o -> !o.isSuccess())
                .map(DispatchOutcome::getError)
                .toList();
        if (batchErrors.isEmpty()) {
            return failed;
        }
        return Stream.concat(batchErrors.stream(), failed.stream()).toList();
    }

    public boolean isSuccess() {
        return errors().isEmpty();
    }
}
