package com.genbridge.gateway.backend.http;

import com.genbridge.gateway.error.BackendCallException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Authenticated HTTP plumbing shared by both DashScope transport families.
 *
 * Every request carries {@code Authorization: Bearer <key>}; creation requests
 * for background tasks also carry {@code X-DashScope-Async: enable}. Calls are
 * non-blocking ({@link HttpClient#sendAsync}); the response is returned
 * whatever its status code, and only I/O failures complete the future
 * exceptionally, as {@link BackendCallException}.
 */
@Component
public class ProviderHttpTransport {

    private static final Logger log = LoggerFactory.getLogger(ProviderHttpTransport.class);

    static final String ASYNC_HEADER = "X-DashScope-Async";

    private final HttpClient http;
    private final String     baseUrl;
    private final Duration   requestTimeout;

    public ProviderHttpTransport(
            HttpClient httpClient,
            @Value("${genbridge.dashscope.base-url}") String baseUrl,
            @Value("${genbridge.dashscope.request-timeout:PT60S}") Duration requestTimeout) {
        this.http           = httpClient;
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    /** POST a JSON body to {@code <base-url>/<resource>}. */
    public CompletableFuture<HttpResponse<String>> post(String resource, String jsonBody, String apiKey, boolean async) {
        HttpRequest.Builder req;
        try {
            req = authorized(resource, apiKey);
        } catch (IllegalArgumentException e) {
            return invalidUri("POST " + resource, e);
        }
        req.header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody));
        if (async) {
            req.header(ASYNC_HEADER, "enable");
        }
        return send(req.build(), "POST " + resource);
    }

    /** GET {@code <base-url>/<path>}. */
    public CompletableFuture<HttpResponse<String>> get(String path, String apiKey) {
        HttpRequest.Builder req;
        try {
            req = authorized(path, apiKey);
        } catch (IllegalArgumentException e) {
            return invalidUri("GET " + path, e);
        }
        return send(req.GET().build(), "GET " + path);
    }

    /**
     * GET {@code <base-url>/tasks/<taskId>}. The id is opaque and is sent as a
     * single encoded path segment.
     */
    public CompletableFuture<HttpResponse<String>> getTask(String taskId, String apiKey) {
        if (".".equals(taskId) || "..".equals(taskId)) {
            return CompletableFuture.failedFuture(
                    new BackendCallException("'" + taskId + "' is not a usable task id", -1, null));
        }
        return get(taskPath(taskId), apiKey);
    }

    static String taskPath(String taskId) {
        return "tasks/" + UriUtils.encodePathSegment(taskId, StandardCharsets.UTF_8);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder authorized(String path, String apiKey) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/" + trimmed))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json");
    }

    private static CompletableFuture<HttpResponse<String>> invalidUri(String opName, IllegalArgumentException e) {
        return CompletableFuture.failedFuture(
                new BackendCallException(opName + " failed: invalid request URI: " + e.getMessage(), e));
    }

    private CompletableFuture<HttpResponse<String>> send(HttpRequest request, String opName) {
        log.debug("{} -> {}", opName, request.uri());
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(resp -> {
                    log.debug("{} <- HTTP {}", opName, resp.statusCode());
                    return resp;
                })
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    throw new BackendCallException(opName + " failed: " + cause.getMessage(), cause);
                });
    }
}
