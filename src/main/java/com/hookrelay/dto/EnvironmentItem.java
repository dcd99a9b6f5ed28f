package com.hookrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * One environment variable handed to the triggered build.
 *
 * Example JSON:
 * { "mapped_to": "DEPLOY_TARGET", "value": "staging", "is_expand": false }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@EqualsAndHashCode @ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EnvironmentItem {

    @JsonProperty("mapped_to")
    private String mappedTo;

    @JsonProperty("value")
    private String value;

    @JsonProperty("is_expand")
    private Boolean isExpand;
}
