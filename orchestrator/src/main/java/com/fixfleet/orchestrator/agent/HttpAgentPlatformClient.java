package com.fixfleet.orchestrator.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixfleet.orchestrator.agent.dto.CreateSessionRequest;
import com.fixfleet.orchestrator.agent.dto.CreateSessionResponse;
import com.fixfleet.orchestrator.agent.dto.SessionDetailsResponse;
import com.fixfleet.orchestrator.config.RetryPolicy;
import com.fixfleet.orchestrator.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the agent platform REST API.
 *
 *   POST /sessions        create a fix session (idempotent)
 *   GET  /sessions/{id}   status_enum + pull_request.url
 *
 * Uses java.net.http.HttpClient with the shared {@link RetryPolicy}: IO errors,
 * 429 and 502-504 are retried with exponential backoff, anything else non-2xx
 * fails immediately. Called from the session-creation pool and the poller, so
 * blocking I/O here is fine.
 */
@Component
public class HttpAgentPlatformClient implements AgentPlatformClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAgentPlatformClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final RetryPolicy  retryPolicy;
    private final String       baseUrl;
    private final String       apiKey;

    @Autowired
    public HttpAgentPlatformClient(
            @Value("${fixfleet.agent.base-url}") String baseUrl,
            @Value("${fixfleet.agent.api-key:}") String apiKey,
            ObjectMapper objectMapper,
            RetryPolicy retryPolicy) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                baseUrl, apiKey, objectMapper, retryPolicy);
    }

    HttpAgentPlatformClient(HttpClient http, String baseUrl, String apiKey,
                            ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.http        = http;
        this.baseUrl     = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey      = apiKey;
        this.json        = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    @Override
    public CreatedSession createSession(SessionSpec spec) {
        log.info("Creating agent session '{}' (max ACU {})", spec.title(), spec.maxAcuLimit());
        String body = toJson(new CreateSessionRequest(
                spec.prompt(), true, spec.tags(), spec.title(), spec.maxAcuLimit()));
        HttpRequest req = request("/sessions")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        CreateSessionResponse resp = parse(send(req, "createSession"), CreateSessionResponse.class, "createSession");
        if (resp.session_id() == null || resp.session_id().isBlank()) {
            throw new AgentPlatformException("createSession returned no session_id", 200);
        }
        if (Boolean.FALSE.equals(resp.is_new_session())) {
            log.info("Agent platform returned existing session {} for '{}'", resp.session_id(), spec.title());
        }
        return new CreatedSession(resp.session_id(), resp.url());
    }

    @Override
    public SessionSnapshot getSession(String sessionId) {
        HttpRequest req = request("/sessions/" + sessionId).GET().build();
        SessionDetailsResponse resp = parse(send(req, "getSession " + sessionId),
                SessionDetailsResponse.class, "getSession " + sessionId);
        return new SessionSnapshot(sessionId, SessionStatus.fromPlatform(resp.status_enum()), resp.prUrl());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder request(String path) {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            b.header("Authorization", "Bearer " + apiKey);
        }
        return b;
    }

    private String send(HttpRequest req, String opName) {
        HttpResponse<String> resp;
        try {
            resp = retryPolicy.send(http, req, opName);
        } catch (IOException e) {
            throw new AgentPlatformException(opName + " failed after " + retryPolicy.maxAttempts() + " attempts", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentPlatformException(opName + " interrupted", e);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new AgentPlatformException(
                    opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body(), resp.statusCode());
        }
        return resp.body();
    }

    private <T> T parse(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new AgentPlatformException("Failed to parse " + opName + " response", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new AgentPlatformException("JSON serialization failed", e);
        }
    }
}
