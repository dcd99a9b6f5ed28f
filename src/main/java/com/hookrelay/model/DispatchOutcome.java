package com.hookrelay.model;

import com.hookrelay.dto.TriggerParams;
import lombok.Value;

/**
 * Result of one downstream trigger attempt. {@code error} is null on success.
 */
@Value
public class DispatchOutcome {

    int index;
    TriggerParams params;
    String error;

    public static DispatchOutcome success(int index, TriggerParams params) {
        return new DispatchOutcome(index, params, null);
    }

    public static DispatchOutcome failure(int index, TriggerParams params, String error) {
        return new DispatchOutcome(index, params, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
