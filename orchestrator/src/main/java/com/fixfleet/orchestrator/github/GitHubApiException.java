package com.fixfleet.orchestrator.github;

/**
 * Thrown when the GitHub API returns an error or is unreachable.
 */
public class GitHubApiException extends RuntimeException {

    public GitHubApiException(String message) {
        super(message);
    }

    public GitHubApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
