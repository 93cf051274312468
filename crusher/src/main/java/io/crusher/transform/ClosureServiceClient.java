package io.crusher.transform;

import io.crusher.budget.RequestThrottle;
import io.crusher.error.RemoteServiceException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.stream.Collectors;

/**
 * Client for the hosted Closure Compiler service. Transport errors and non-2xx answers fail the
 * call; nothing is retried.
 */
public class ClosureServiceClient {
    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;
    private final RequestThrottle throttle;

    public ClosureServiceClient(URI uri, Duration timeout, RequestThrottle throttle) {
        this.client = HttpClient.newBuilder().connectTimeout(timeout == null ? Duration.ofSeconds(10) : timeout).build();
        this.uri = uri;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
        this.throttle = throttle == null ? RequestThrottle.unlimited() : throttle;
    }

    public URI uri() { return uri; }

    public CompletionStage<String> compile(String code) {
        HttpRequest req = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form(code)))
                .build();
        return throttle.acquire()
                .thenCompose(v -> client.sendAsync(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)))
                .handle((resp, ex) -> {
                    if (ex != null) {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        return CompletableFuture.<String>failedFuture(
                                new RemoteServiceException("Closure service call to " + uri + " failed: " + cause, cause));
                    }
                    if (resp.statusCode() / 100 != 2) {
                        return CompletableFuture.<String>failedFuture(new RemoteServiceException(
                                "Closure service answered " + resp.statusCode(), resp.statusCode()));
                    }
                    return CompletableFuture.completedFuture(resp.body());
                })
                .thenCompose(stage -> stage);
    }

    static String form(String code) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("output_format", "text");
        fields.put("output_info", "compiled_code");
        fields.put("js_code", code == null ? "" : code);
        fields.put("compilation_level", "SIMPLE_OPTIMIZATIONS");
        fields.put("charset", "ascii");
        fields.put("language_in", "ECMASCRIPT5");
        fields.put("warning_level", "QUIET");
        return fields.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
