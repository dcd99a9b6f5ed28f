package com.hookrelay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Process-level settings, read once at startup.
 *
 * Bound from application.yml under "hookrelay" prefix:
 *   hookrelay:
 *     env-mode: production
 *     trigger:
 *       base-url: https://app.bitrise.io
 *       send-request-to-url: http://localhost:3000/echo   # optional override
 *       connect-timeout-ms: 5000
 *       read-timeout-ms: 20000
 *     dispatch:
 *       max-parallel: 1
 *
 * Nothing reads these values through a static; the beans built in
 * TriggerConfiguration get them injected instead.
 */
@ConfigurationProperties(prefix = "hookrelay")
@Validated
@Getter
@Setter
public class HookRelayProperties {

    private EnvMode envMode = EnvMode.DEVELOPMENT;
    @Valid
    private Trigger trigger = new Trigger();

    @Valid
    private Dispatch dispatch = new Dispatch();

    public enum EnvMode {
        DEVELOPMENT,
        PRODUCTION
    }

    @Getter
    @Setter
    public static class Trigger {
        @NotBlank
        private String baseUrl = "https://app.bitrise.io";

        /**
         * When set, every build is triggered against this URL instead of the
         * one derived from the app slug, and calls are always performed for real.
         */
        private String sendRequestToUrl;

        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 20000;
    }

    @Getter
    @Setter
    public static class Dispatch {
        /** 1 = strictly sequential fan-out. */
        @Min(1)
        private int maxParallel = 1;
    }

    /**
     * Real downstream calls happen when an override URL is configured or the
     * service runs in production mode. Anything else only logs.
     */
    public boolean isPerformRealCalls() {
        return (trigger.getSendRequestToUrl() != null && !trigger.getSendRequestToUrl().isBlank())
                || envMode == EnvMode.PRODUCTION;
    }
}
