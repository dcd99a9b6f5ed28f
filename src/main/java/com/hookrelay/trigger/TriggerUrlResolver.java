package com.hookrelay.trigger;

import com.hookrelay.exception.TriggerUrlException;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;

/**
 * Works out where a build should be triggered.
 *
 *   override set → the override, unchanged
 *   otherwise    → {baseUrl}/app/{app-slug}/build/start.json
 */
public class TriggerUrlResolver {

    private final String baseUrl;
    private final URI overrideUrl;

    public TriggerUrlResolver(String baseUrl, URI overrideUrl) {
        this.baseUrl = baseUrl;
        this.overrideUrl = overrideUrl;
    }

    /**
     * @throws TriggerUrlException when no endpoint can be built for this app slug
     */
    public URI resolve(String appSlug) {
        if (overrideUrl != null) {
            return overrideUrl;
        }
        try {
            return UriComponentsBuilder.fromHttpUrl(baseUrl)
                    .pathSegment("app", appSlug, "build", "start.json")
                    .encode()
                    .build()
                    .toUri();
        } catch (IllegalArgumentException e) {
            throw new TriggerUrlException(e.getMessage(), e);
        }
    }

    public boolean isOverridden() {
        return overrideUrl != null;
    }
}
