package com.fixfleet.orchestrator.github;

import com.fixfleet.orchestrator.model.PullRequestState;

import java.util.Optional;

/** Read-only view of pull requests opened by agent sessions. */
public interface PullRequestClient {

    /**
     * Current state of the PR at {@code prUrl}.
     *
     * @return empty when the URL is not a PR this client understands
     * @throws GitHubApiException when the lookup fails after retries
     */
    Optional<PullRequestState> fetchState(String prUrl);
}
