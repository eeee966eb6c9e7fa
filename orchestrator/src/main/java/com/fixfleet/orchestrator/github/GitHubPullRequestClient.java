package com.fixfleet.orchestrator.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.config.RetryPolicy;
import com.fixfleet.orchestrator.model.PullRequestState;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pull request lookups against the GitHub REST API (GET /repos/{owner}/{repo}/pulls/{n}).
 *
 * merged → MERGED, closed unmerged → CLOSED, otherwise OPEN.
 */
@Component
public class GitHubPullRequestClient implements PullRequestClient {

    // https://github.com/{owner}/{repo}/pull/{number}
    private static final Pattern PR_URL = Pattern.compile("github\\.com/([^/]+)/([^/]+)/pull/(\\d+)");

    private final HttpClient   http;
    private final ObjectMapper json;
    private final RetryPolicy  retryPolicy;
    private final String       apiBaseUrl;
    private final String       token;

    @Autowired
    public GitHubPullRequestClient(
            @Value("${fixfleet.github.api-base-url:https://api.github.com}") String apiBaseUrl,
            @Value("${fixfleet.github.token:}") String token,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                apiBaseUrl, token, objectMapper, retryPolicy);
    }

    GitHubPullRequestClient(HttpClient http, String apiBaseUrl, String token,
                            ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.http        = http;
        this.apiBaseUrl  = apiBaseUrl;
        this.token       = token;
        this.json        = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public Optional<PullRequestState> fetchState(String prUrl) {
        if (prUrl == null) return Optional.empty();
        Matcher m = PR_URL.matcher(prUrl);
        if (!m.find()) return Optional.empty();

        String path = "/repos/" + m.group(1) + "/" + m.group(2) + "/pulls/" + m.group(3);
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + path))
                .timeout(Duration.ofSeconds(30))
                .header("Accept", "application/vnd.github+json")
                .GET();
        if (token != null && !token.isBlank()) {
            b.header("Authorization", "Bearer " + token);
        }

        HttpResponse<String> resp;
        try {
            resp = retryPolicy.send(http, b.build(), "fetchPullRequest " + prUrl);
        } catch (IOException e) {
            throw new GitHubApiException("fetchPullRequest failed for " + prUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException("fetchPullRequest interrupted for " + prUrl, e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new GitHubApiException("fetchPullRequest failed for " + prUrl
                    + ": HTTP " + resp.statusCode());
        }

        try {
            JsonNode pr = json.readTree(resp.body());
            if (pr.path("merged").asBoolean(false) || pr.hasNonNull("merged_at")) {
                return Optional.of(PullRequestState.MERGED);
            }
            return Optional.of("closed".equals(pr.path("state").asText()) ? PullRequestState.CLOSED : PullRequestState.OPEN);
        } catch (JsonProcessingException e) {
            throw new GitHubApiException("Failed to parse pull request " + prUrl, e);
        }
    }
}
