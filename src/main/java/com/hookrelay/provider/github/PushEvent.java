package com.hookrelay.provider.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * The parts of a GitHub {@code push} payload the relay reads.
 * Unknown fields are ignored.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PushEvent {

    @JsonProperty("ref")
    private String ref;

    @JsonProperty("deleted")
    private boolean deleted;

    @JsonProperty("head_commit")
    private Commit headCommit;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Commit {

        @JsonProperty("distinct")
        private boolean distinct;

        @JsonProperty("id")
        private String id;

        @JsonProperty("message")
        private String message;
    }
}
