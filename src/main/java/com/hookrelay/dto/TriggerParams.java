package com.hookrelay.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.*;

import java.util.List;

/**
 * One build to start. Owned by the build-trigger API: the relay passes it
 * through as-is, it never inspects the fields.
 *
 * Example JSON (the "build_params" object of a trigger call):
 * {
 *   "branch": "feature/login",
 *   "commit_hash": "83b86e5f286f546dc5a4a58db66ceef44460c85e",
 *   "commit_message": "Fix the login button"
 * }
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@EqualsAndHashCode @ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TriggerParams {

    @JsonProperty("branch")
    private String branch;

    @JsonProperty("commit_hash")
    private String commitHash;

    @JsonProperty("commit_message")
    private String commitMessage;

    @JsonProperty("tag")
    private String tag;

    @JsonProperty("pull_request_id")
    private Integer pullRequestId;

    @JsonProperty("branch_dest")
    private String branchDest;

    @JsonProperty("pull_request_repository_url")
    private String pullRequestRepositoryUrl;

    @JsonProperty("pull_request_merge_branch")
    private String pullRequestMergeBranch;

    @JsonProperty("pull_request_head_branch")
    private String pullRequestHeadBranch;

    @JsonProperty("environments")
    private List<EnvironmentItem> environments;
}
