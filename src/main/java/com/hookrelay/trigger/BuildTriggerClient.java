package com.hookrelay.trigger;

import com.hookrelay.dto.TriggerParams;
import com.hookrelay.exception.TriggerDispatchException;

import java.net.URI;

/**
 * Starts one build on the downstream trigger API.
 *
 * Which implementation is used (real HTTP call or log only) is decided once,
 * in TriggerConfiguration, from the process configuration.
 */
public interface BuildTriggerClient {

    /**
     * @throws TriggerDispatchException when the build could not be started
     */
    void trigger(URI url, String apiToken, TriggerParams params);
}
