package com.nursingjobs.pipeline.ingest.http;

import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Outbound HTTP for source pages and index submissions. Sends a browser-like request identity,
 * spaces requests to the same host, and retries transient failures with jittered backoff,
 * waiting at least as long as a {@code Retry-After} header asks.
 * Failures are returned as {@link HttpFetchResult} values, never thrown.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 425, 429, 500, 502, 503, 504);
    private static final Set<String> FINAL_ERROR_CODES = Set.of("invalid_url", "interrupted", "bad_request");

    private final PipelineProperties properties;
    private final HttpClient client;
    private final Map<String, Instant> nextSlotByHost = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        PipelineProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return execute(new Outbound(url, "GET", acceptHeader, null));
    }

    /**
     * Posts a JSON body. Used for Workday-style listing endpoints and IndexNow submissions.
     */
    public HttpFetchResult postJson(String url, String jsonBody, String acceptHeader) {
        return execute(new Outbound(url, "POST", acceptHeader, jsonBody == null ? "" : jsonBody));
    }

    private HttpFetchResult execute(Outbound outbound) {
        URI uri = normalizeUri(outbound.url());
        if (uri == null || uri.getHost() == null) {
            return failure(outbound.url(), Instant.now(), 1, "invalid_url", "URL missing host or malformed");
        }
        int attemptBudget = 1 + Math.max(0, properties.getRequestMaxRetries());
        int attempt = 0;
        while (true) {
            attempt++;
            Attempt outcome = attemptOnce(outbound, uri, attempt);
            HttpFetchResult result = outcome.result();
            if (!isTransient(result)) {
                return result;
            }
            if (attempt >= attemptBudget) {
                log.info("{} {} still failing after {} attempt(s): {}", outbound.method(), outbound.url(), attempt, result.describeFailure());
                return result;
            }
            long waitMs = backoffMs(attempt, outcome.retryAfter());
            log.debug("{} {} failed with {}; attempt {}/{} in {} ms", outbound.method(), outbound.url(), result.describeFailure(), attempt + 1, attemptBudget, waitMs);
            if (!pause(waitMs)) {
                return result;
            }
        }
    }

    private Attempt attemptOnce(Outbound outbound, URI uri, int attempt) {
        Instant startedAt = Instant.now();
        try {
            waitForHostSlot(uri.getHost().toLowerCase(Locale.ROOT));
            HttpResponse<byte[]> response = client.send(outbound.toRequest(uri, properties), HttpResponse.BodyHandlers.ofByteArray());
            byte[] bytes = response.body();
            HttpFetchResult result = new HttpFetchResult(
                outbound.url(),
                response.uri(),
                response.statusCode(),
                bytes == null ? null : new String(bytes, StandardCharsets.UTF_8),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                attempt,
                null,
                null
            );
            return new Attempt(result, retryAfter(response.headers().firstValue("Retry-After").orElse(null)));
        } catch (HttpTimeoutException e) {
            return new Attempt(failure(outbound.url(), startedAt, attempt, "timeout", e.getMessage()), null);
        } catch (IOException e) {
            return new Attempt(failure(outbound.url(), startedAt, attempt, "io_error", e.getMessage()), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Attempt(failure(outbound.url(), startedAt, attempt, "interrupted", e.getMessage()), null);
        } catch (IllegalArgumentException e) {
            return new Attempt(failure(outbound.url(), startedAt, attempt, "bad_request", e.getMessage()), null);
        }
    }

    static boolean isTransient(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        if (result.errorCode() != null) {
            return !FINAL_ERROR_CODES.contains(result.errorCode());
        }
        return TRANSIENT_STATUSES.contains(result.statusCode());
    }

    /**
     * Delay-seconds form only; an HTTP-date Retry-After falls back to the computed backoff.
     */
    static Duration retryAfter(String header) {
        if (header == null || header.isBlank() || !header.trim().matches("\\d{1,6}")) {
            return null;
        }
        return Duration.ofSeconds(Long.parseLong(header.trim()));
    }

    private long backoffMs(int attempt, Duration retryAfter) {
        long base = Math.max(0, properties.getRequestRetryBaseDelayMs());
        long ceiling = properties.getRequestRetryMaxDelayMs() > 0 ? properties.getRequestRetryMaxDelayMs() : Long.MAX_VALUE;
        long exponential = Math.min(ceiling, base << Math.min(20, attempt - 1));
        long jittered = exponential <= 1 ? exponential : exponential / 2 + ThreadLocalRandom.current().nextLong(exponential / 2 + 1);
        long requested = retryAfter == null ? 0 : retryAfter.toMillis();
        return Math.min(ceiling, Math.max(jittered, requested));
    }

    private boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Reserves the next request slot for the host, then sleeps until it opens.
     */
    private void waitForHostSlot(String host) throws InterruptedException {
        Duration spacing = Duration.ofMillis(Math.max(0, properties.getPerHostDelayMs()));
        Instant[] reserved = new Instant[1];
        nextSlotByHost.compute(host, (ignored, nextFree) -> {
            Instant now = Instant.now();
            Instant slot = nextFree == null || nextFree.isBefore(now) ? now : nextFree;
            reserved[0] = slot;
            return slot.plus(spacing);
        });
        long waitMs = Duration.between(Instant.now(), reserved[0]).toMillis();
        if (waitMs > 0) {
            Thread.sleep(waitMs);
        }
    }

    private HttpFetchResult failure(String url, Instant startedAt, int attempt, String code, String message) {
        Instant now = Instant.now();
        return new HttpFetchResult(url, null, 0, null, null, now, Duration.between(startedAt, now), attempt, code, message);
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private record Attempt(HttpFetchResult result, Duration retryAfter) {
    }

    private record Outbound(String url, String method, String accept, String jsonBody) {
        HttpRequest toRequest(URI uri, PipelineProperties properties) {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", accept == null || accept.isBlank() ? "*/*" : accept)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (jsonBody == null) {
                return builder.GET().build();
            }
            return builder
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody, StandardCharsets.UTF_8))
                .build();
        }
    }
}
