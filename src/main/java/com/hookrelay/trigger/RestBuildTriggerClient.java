package com.hookrelay.trigger;

import com.hookrelay.dto.TriggerApiRequest;
import com.hookrelay.dto.TriggerParams;
import com.hookrelay.exception.TriggerDispatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;

/**
 * POSTs the trigger request to the build API.
 *
 * Timeouts live on the injected RestTemplate. Any non-2xx answer or transport
 * error becomes a {@link TriggerDispatchException}; nothing is retried.
 */
@RequiredArgsConstructor
@Slf4j
public class RestBuildTriggerClient implements BuildTriggerClient {

    private final RestTemplate restTemplate;

    @Override
    public void trigger(URI url, String apiToken, TriggerParams params) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        HttpEntity<TriggerApiRequest> request = new HttpEntity<>(TriggerApiRequest.of(apiToken, params), headers);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(url, request, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new TriggerDispatchException("HTTP " + response.getStatusCode().value()
                        + " from " + url + ": " + response.getBody());
            }
            log.info("Triggered build → url={}, status={}, params={}", url, response.getStatusCode(), params);
        } catch (RestClientResponseException e) {
            log.error("Build trigger rejected: url={}, status={}, body={}",
                    url, e.getStatusCode(), e.getResponseBodyAsString());
            throw new TriggerDispatchException("HTTP " + e.getStatusCode().value()
                    + " from " + url + ": " + e.getResponseBodyAsString(), e);
        } catch (RestClientException e) {
            log.error("Build trigger call failed: url={}, error={}", url, e.getMessage(), e);
            throw new TriggerDispatchException(e.getMessage(), e);
        }
    }
}
