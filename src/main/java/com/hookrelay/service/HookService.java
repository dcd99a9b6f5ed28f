package com.hookrelay.service;

import com.hookrelay.dto.HookParams;
import com.hookrelay.exception.HookRejectedException;
import com.hookrelay.exception.MissingParameterException;
import com.hookrelay.exception.NoEventDetectedException;
import com.hookrelay.exception.TransformFailedException;
import com.hookrelay.exception.UnsupportedProviderException;
import com.hookrelay.model.DispatchReport;
import com.hookrelay.model.HookOutcome;
import com.hookrelay.model.TransformResult;
import com.hookrelay.provider.HookProvider;
import com.hookrelay.provider.ProviderRegistry;
import com.hookrelay.provider.WebhookRequest;
import com.hookrelay.trigger.TriggerDispatcher;
import com.hookrelay.trigger.TriggerUrlResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;

/**
 * The webhook pipeline.
 *
 * FLOW:
 *   1. Validate service id, app slug, API token (first missing one wins)
 *   2. Resolve the provider for the service id
 *   3. Transform the raw request
 *        skip   → acknowledged
 *        error  → rejected
 *        params → continue
 *   4. Resolve the trigger URL for the app slug; no params → rejected
 *   5. Dispatch every trigger param and compose the result
 *
 * Every rejection is a HookRejectedException caught here, so the caller always
 * gets a composed outcome and no request failure escapes as a server error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HookService {

    private final ProviderRegistry providerRegistry;
    private final TriggerUrlResolver triggerUrlResolver;
    private final TriggerDispatcher triggerDispatcher;
    private final OutcomeComposer outcomeComposer;

    public HookOutcome handle(HookParams params, WebhookRequest request) {
        try {
            validate(params);
            log.info("Processing hook: service={}, app={}", params.getServiceId(), params.getAppSlug());

            HookProvider provider = providerRegistry.lookup(params.getServiceId())
                    .orElseThrow(() -> new UnsupportedProviderException(params.getServiceId()));

            TransformResult result = transform(provider, request);

            if (result.isShouldSkip()) {
                log.info("Skipping hook: service={}, reason={}", params.getServiceId(), result.getSkipReason());
                return outcomeComposer.skipped(result.getSkipReason());
            }
            if (result.hasError()) {
                log.debug("Failed to transform the webhook: {}", result.getError());
                throw new TransformFailedException(result.getError());
            }

            URI triggerUrl = triggerUrlResolver.resolve(params.getAppSlug());
            if (result.getTriggerParams().isEmpty()) {
                throw new NoEventDetectedException();
            }
            DispatchReport report = triggerDispatcher.dispatch(
                    triggerUrl, params.getApiToken(), result.getTriggerParams());
            return outcomeComposer.dispatched(report);
        } catch (HookRejectedException e) {
            log.warn("Rejected hook: service={}, errors={}", params.getServiceId(), e.getErrors());
            return outcomeComposer.rejected(e);
        }
    }

    // Provider failures are rejections of this one payload.
    private static TransformResult transform(HookProvider provider, WebhookRequest request) {
        try {
            return provider.transform(request);
        } catch (RuntimeException e) {
            log.error("Provider '{}' failed on the payload: {}", provider.serviceId(), e.getMessage(), e);
            throw new TransformFailedException(String.valueOf(e.getMessage()), e);
        }
    }

    private void validate(HookParams params) {
        if (isBlank(params.getServiceId())) {
            throw new MissingParameterException("No service-id defined");
        }
        if (isBlank(params.getAppSlug())) {
            throw new MissingParameterException("No App Slug parameter defined");
        }
        if (isBlank(params.getApiToken())) {
            throw new MissingParameterException("No API Token parameter defined");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
