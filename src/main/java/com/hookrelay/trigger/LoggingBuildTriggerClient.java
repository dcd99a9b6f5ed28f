package com.hookrelay.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.dto.TriggerApiRequest;
import com.hookrelay.dto.TriggerParams;
import com.hookrelay.exception.TriggerDispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;

/**
 * Development-mode client: renders the request it would send and logs it.
 * The API token is masked in the log line.
 */
@RequiredArgsConstructor
@Slf4j
public class LoggingBuildTriggerClient implements BuildTriggerClient {

    private static final String MASKED_TOKEN = "***";

    private final ObjectMapper objectMapper;

    @Override
    public void trigger(URI url, String apiToken, TriggerParams params) {
        try {
            String body = objectMapper.writeValueAsString(TriggerApiRequest.of(MASKED_TOKEN, params));
            log.info("[log only] Would trigger build → url={}, body={}", url, body);
        } catch (JsonProcessingException e) {
            throw new TriggerDispatchException("could not serialize trigger request: " + e.getOriginalMessage(), e);
        }
    }
}
