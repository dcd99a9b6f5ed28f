package com.hookrelay.dto;

import lombok.*;

/**
 * The three caller-supplied values of a hook URL. Any of them may be null or
 * blank here; HookService reports the first one missing.
 *
 *   POST /h/{service-id}/{app-slug}/{api-token}
 *   POST /h?service_id=github&app_slug=...&api_token=...
 */
@Getter @NoArgsConstructor @AllArgsConstructor @Builder
public class HookParams {

    private String serviceId;
    private String appSlug;
    private String apiToken;
}
