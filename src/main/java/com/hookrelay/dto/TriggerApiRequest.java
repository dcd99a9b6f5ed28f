package com.hookrelay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * Body POSTed to the build-trigger endpoint:
 * {
 *   "hook_info": {"type": "bitrise", "api_token": "..."},
 *   "build_params": {...},
 *   "triggered_by": "webhook"
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class TriggerApiRequest {

    public static final String TRIGGERED_BY_WEBHOOK = "webhook";

    @JsonProperty("hook_info")
    private HookInfo hookInfo;

    @JsonProperty("build_params")
    private TriggerParams buildParams;

    @JsonProperty("triggered_by")
    private String triggeredBy;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    public static class HookInfo {

        public static final String TYPE_BITRISE = "bitrise";

        @JsonProperty("type")
        private String type;

        @JsonProperty("api_token")
        private String apiToken;
    }

    public static TriggerApiRequest of(String apiToken, TriggerParams params) {
        return TriggerApiRequest.builder()
                .hookInfo(new HookInfo(HookInfo.TYPE_BITRISE, apiToken))
                .buildParams(params)
                .triggeredBy(TRIGGERED_BY_WEBHOOK)
                .build();
    }
}
