package com.hookrelay.provider.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hookrelay.dto.TriggerParams;
import com.hookrelay.model.TransformResult;
import com.hookrelay.provider.HookProvider;
import com.hookrelay.provider.WebhookRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * Turns GitHub webhook deliveries into build triggers.
 *
 * Handles two events, read from the X-GitHub-Event header:
 *   push         → one build for the pushed branch or tag
 *   pull_request → one build for the PR head, merged into its base
 *
 * "ping" and every other event type are acknowledged and skipped.
 */
@Component
@RequiredArgsConstructor
public class GithubHookProvider implements HookProvider {

    static final String SERVICE_ID = "github";
    static final String EVENT_HEADER = "X-GitHub-Event";

    private static final String JSON_CONTENT_TYPE = "application/json";
    private static final String BRANCH_REF_PREFIX = "refs/heads/";
    private static final String TAG_REF_PREFIX = "refs/tags/";
    private static final Set<String> BUILDABLE_PR_ACTIONS = Set.of("opened", "reopened", "synchronize", "edited");

    private final ObjectMapper objectMapper;

    @Override
    public String serviceId() {
        return SERVICE_ID;
    }

    @Override
    public TransformResult transform(WebhookRequest request) {
        String contentType = mediaType(request.getContentType());
        if (!JSON_CONTENT_TYPE.equals(contentType)) {
            return TransformResult.error("Content-Type is not supported: " + request.getContentType());
        }

        String event = request.header(EVENT_HEADER);
        if (event == null || event.isBlank()) {
            return TransformResult.error("Issue with X-Github-Event Header: No value found in header");
        }

        switch (event) {
            case "ping":
                return TransformResult.skip("Ping event received");
            case "push":
            case "pull_request":
                break;
            default:
                return TransformResult.skip("Unsupported GitHub Webhook event: " + event);
        }

        if (!request.hasBody()) {
            return TransformResult.error("Failed to read content of request body: no or empty request body");
        }

        try {
            if ("push".equals(event)) {
                PushEvent push = objectMapper.readValue(request.getBody(), PushEvent.class);
                return push == null ? emptyDocument() : transformPush(push);
            }
            PullRequestEvent pullRequest = objectMapper.readValue(request.getBody(), PullRequestEvent.class);
            return pullRequest == null ? emptyDocument() : transformPullRequest(pullRequest);
        } catch (IOException e) {
            return TransformResult.error("Failed to parse request body: " + e.getMessage());
        }
    }

    // A JSON "null" document parses without error but carries no event.
    private static TransformResult emptyDocument() {
        return TransformResult.error("Failed to parse request body: empty JSON document");
    }

    TransformResult transformPush(PushEvent push) {
        if (push.isDeleted()) {
            return TransformResult.skip("This is a 'Deleted' event, no build can be started");
        }

        String ref = push.getRef() == null ? "" : push.getRef();
        PushEvent.Commit head = push.getHeadCommit();

        if (ref.startsWith(BRANCH_REF_PREFIX)) {
            if (head != null && !head.isDistinct()) {
                return TransformResult.skip("Head Commit is not Distinct");
            }
            if (head == null || isEmpty(head.getId())) {
                return TransformResult.error("Missing commit hash");
            }
            return TransformResult.trigger(TriggerParams.builder()
                    .branch(ref.substring(BRANCH_REF_PREFIX.length()))
                    .commitHash(head.getId())
                    .commitMessage(head.getMessage())
                    .build());
        }

        if (ref.startsWith(TAG_REF_PREFIX)) {
            if (head == null || isEmpty(head.getId())) {
                return TransformResult.error("The tag's head commit has no hash");
            }
            return TransformResult.trigger(TriggerParams.builder()
                    .tag(ref.substring(TAG_REF_PREFIX.length()))
                    .commitHash(head.getId())
                    .commitMessage(head.getMessage())
                    .build());
        }

        return TransformResult.skip("Ref (" + ref + ") is not a head nor a tag ref");
    }

    TransformResult transformPullRequest(PullRequestEvent event) {
        String action = event.getAction();
        if (action == null || !BUILDABLE_PR_ACTIONS.contains(action)) {
            return TransformResult.skip("Pull Request action doesn't require a build: " + action);
        }
        if ("edited".equals(action) && !baseBranchChanged(event)) {
            return TransformResult.skip("Pull Request edit doesn't require a build: "
                    + "only title and/or description was changed, no base branch change");
        }

        PullRequestEvent.PullRequest pr = event.getPullRequest();
        if (pr == null || pr.getHead() == null || pr.getBase() == null) {
            return TransformResult.error("Missing pull_request data");
        }
        if (pr.isMerged()) {
            return TransformResult.skip("Pull Request already merged");
        }
        if (Boolean.FALSE.equals(pr.getMergeable())) {
            return TransformResult.skip("Pull Request is not mergeable");
        }

        return TransformResult.trigger(TriggerParams.builder()
                .commitHash(pr.getHead().getSha())
                .commitMessage(commitMessage(pr))
                .branch(pr.getHead().getRef())
                .branchDest(pr.getBase().getRef())
                .pullRequestId(pr.getNumber())
                .pullRequestRepositoryUrl(repositoryUrl(pr.getHead().getRepo()))
                .pullRequestMergeBranch("pull/" + pr.getNumber() + "/merge")
                .pullRequestHeadBranch("pull/" + pr.getNumber() + "/head")
                .build());
    }

    private static boolean baseBranchChanged(PullRequestEvent event) {
        PullRequestEvent.Changes changes = event.getChanges();
        return changes != null
                && changes.getBase() != null
                && changes.getBase().getRef() != null
                && !isEmpty(changes.getBase().getRef().getFrom());
    }

    private static String commitMessage(PullRequestEvent.PullRequest pr) {
        String title = pr.getTitle() == null ? "" : pr.getTitle();
        if (isEmpty(pr.getBody())) {
            return title;
        }
        return title + "\n\n" + pr.getBody();
    }

    // Private repos are only reachable over SSH with the build's key.
    private static String repositoryUrl(PullRequestEvent.Repo repo) {
        if (repo == null) {
            return null;
        }
        return repo.isPrivateRepo() ? repo.getSshUrl() : repo.getCloneUrl();
    }

    private static String mediaType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int paramStart = contentType.indexOf(';');
        String type = paramStart < 0 ? contentType : contentType.substring(0, paramStart);
        return type.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
