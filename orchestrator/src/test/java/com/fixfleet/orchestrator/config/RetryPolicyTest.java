package com.fixfleet.orchestrator.config;

import com.fixfleet.orchestrator.CannedHttpResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link RetryPolicy}.
 *
 * The HTTP client is mocked and every policy runs without backoff.
 */
@ExtendWith(MockitoExtension.class)
class RetryPolicyTest {

    @Mock HttpClient http;

    private final HttpRequest request = HttpRequest.newBuilder(URI.create("https://api.example/x")).build();

    @Test
    void retryableStatus_isRetriedUntilSuccess() throws Exception {
        HttpResponse<String> throttled = response(429);
        HttpResponse<String> ok        = response(200);
        doReturn(throttled).doReturn(ok).when(http).send(any(), any());

        HttpResponse<String> result = RetryPolicy.immediate(3).send(http, request, "test");

        assertThat(result.statusCode()).isEqualTo(200);
        verify(http, times(2)).send(any(), any());
    }

    @Test
    void clientError_isNotRetried() throws Exception {
        HttpResponse<String> bad = response(400);
        doReturn(bad).when(http).send(any(), any());

        HttpResponse<String> result = RetryPolicy.immediate(3).send(http, request, "test");

        assertThat(result.statusCode()).isEqualTo(400);
        verify(http, times(1)).send(any(), any());
    }

    @Test
    void lastRetryableResponse_isReturnedWhenAttemptsRunOut() throws Exception {
        HttpResponse<String> unavailable = response(503);
        doReturn(unavailable).when(http).send(any(), any());

        HttpResponse<String> result = RetryPolicy.immediate(2).send(http, request, "test");

        assertThat(result.statusCode()).isEqualTo(503);
        verify(http, times(2)).send(any(), any());
    }

    @Test
    void ioError_isRethrownAfterLastAttempt() throws Exception {
        doThrow(new IOException("connection reset")).when(http).send(any(), any());

        assertThatThrownBy(() -> RetryPolicy.immediate(3).send(http, request, "test"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("connection reset");
        verify(http, times(3)).send(any(), any());
    }

    @Test
    void backoff_doublesPerAttempt() {
        RetryPolicy policy = new RetryPolicy(4, Duration.ofMillis(100), Duration.ZERO);

        assertThat(policy.backoff(0)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofMillis(400));
    }

    private static HttpResponse<String> response(int status) {
        return CannedHttpResponse.of(status);
    }
}
