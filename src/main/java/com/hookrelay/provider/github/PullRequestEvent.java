package com.hookrelay.provider.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

/**
 * The parts of a GitHub {@code pull_request} payload the relay reads.
 *
 * {@code changes.base.ref.from} is only present on "edited" deliveries where
 * the base branch was changed.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PullRequestEvent {

    @JsonProperty("action")
    private String action;

    @JsonProperty("pull_request")
    private PullRequest pullRequest;

    @JsonProperty("changes")
    private Changes changes;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PullRequest {

        @JsonProperty("number")
        private int number;

        @JsonProperty("title")
        private String title;

        @JsonProperty("body")
        private String body;

        @JsonProperty("merged")
        private boolean merged;

        /** Null while GitHub is still computing mergeability. */
        @JsonProperty("mergeable")
        private Boolean mergeable;

        @JsonProperty("head")
        private BranchInfo head;

        @JsonProperty("base")
        private BranchInfo base;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BranchInfo {

        @JsonProperty("ref")
        private String ref;

        @JsonProperty("sha")
        private String sha;

        @JsonProperty("repo")
        private Repo repo;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Repo {

        @JsonProperty("private")
        private boolean privateRepo;

        @JsonProperty("clone_url")
        private String cloneUrl;

        @JsonProperty("ssh_url")
        private String sshUrl;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Changes {

        @JsonProperty("base")
        private BaseChange base;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BaseChange {

        @JsonProperty("ref")
        private From ref;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class From {

        @JsonProperty("from")
        private String from;
    }
}
