package com.monitintel.service.pipeline;

import com.monitintel.core.model.WorkflowContext;
import com.monitintel.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * POSTs the cycle bundle as JSON and returns the response body as the advisory.
 */
public class HttpAnalysisClient implements AnalysisClient {
    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    public HttpAnalysisClient(HttpClient httpClient, URI endpoint, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient is required");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint is required");
        this.timeout = Objects.requireNonNull(timeout, "timeout is required");
    }

    @Override
    public String analyze(WorkflowContext context) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "text/plain, application/json")
                .POST(HttpRequest.BodyPublishers.ofString(JsonUtils.toJson(bundle(context))))
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new IllegalStateException("Analysis endpoint " + endpoint + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for analysis from " + endpoint, e);
        }
        if (response.statusCode() >= 400) {
            throw new IllegalStateException("Analysis endpoint " + endpoint + " returned HTTP " + response.statusCode());
        }
        return response.body() == null ? "" : response.body();
    }

    static Map<String, Object> bundle(WorkflowContext context) {
        Map<String, Object> bundle = new LinkedHashMap<>();
        bundle.put("cycleAt", context.cycleAt());
        bundle.put("criticalServices", context.criticalServices());
        bundle.put("services", context.services().values());
        return bundle;
    }
}
