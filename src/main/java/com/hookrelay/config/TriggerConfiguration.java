package com.hookrelay.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.trigger.BuildTriggerClient;
import com.hookrelay.trigger.LoggingBuildTriggerClient;
import com.hookrelay.trigger.RestBuildTriggerClient;
import com.hookrelay.trigger.TriggerDispatcher;
import com.hookrelay.trigger.TriggerUrlResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.time.Duration;

/**
 * Builds the outbound side from HookRelayProperties.
 *
 * The "real call vs. log only" decision is made here, once: the rest of the
 * application only sees a BuildTriggerClient.
 */
@Configuration
@EnableConfigurationProperties(HookRelayProperties.class)
@Slf4j
public class TriggerConfiguration {

    @Bean
    public RestTemplate triggerRestTemplate(RestTemplateBuilder builder, HookRelayProperties properties) {
        return builder
                .setConnectTimeout(Duration.ofMillis(properties.getTrigger().getConnectTimeoutMs()))
                .setReadTimeout(Duration.ofMillis(properties.getTrigger().getReadTimeoutMs()))
                .build();
    }

    @Bean
    public BuildTriggerClient buildTriggerClient(HookRelayProperties properties,
                                                 RestTemplate triggerRestTemplate,
                                                 ObjectMapper objectMapper) {
        if (properties.isPerformRealCalls()) {
            log.info("Build triggers will be sent (env-mode={}, override={})",
                    properties.getEnvMode(), properties.getTrigger().getSendRequestToUrl());
            return new RestBuildTriggerClient(triggerRestTemplate);
        }
        log.info("Build triggers will only be logged (env-mode={})", properties.getEnvMode());
        return new LoggingBuildTriggerClient(objectMapper);
    }

    @Bean
    public TriggerUrlResolver triggerUrlResolver(HookRelayProperties properties) {
        String override = properties.getTrigger().getSendRequestToUrl();
        URI overrideUrl = override == null || override.isBlank() ? null : URI.create(override);
        return new TriggerUrlResolver(properties.getTrigger().getBaseUrl(), overrideUrl);
    }

    @Bean
    public TriggerDispatcher triggerDispatcher(BuildTriggerClient buildTriggerClient, HookRelayProperties properties) {
        return new TriggerDispatcher(buildTriggerClient, properties.getDispatch().getMaxParallel());
    }
}
