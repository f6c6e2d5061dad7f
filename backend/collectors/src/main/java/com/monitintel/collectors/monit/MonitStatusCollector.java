package com.monitintel.collectors.monit;

import com.monitintel.collectors.api.Collector;
import com.monitintel.collectors.api.CollectorContext;
import com.monitintel.collectors.api.CollectorResult;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.SnapshotsIngested;
import com.monitintel.core.model.Snapshot;

import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Polls the Monit status document and appends one snapshot per service. Every snapshot of a
 * tick shares the same {@code observedAt}.
 */
public class MonitStatusCollector implements Collector {
    public static final String CONFIG_KEY = "monitSource";
    private static final Logger LOGGER = Logger.getLogger(MonitStatusCollector.class.getName());

    @Override
    public String name() {
        return "monitStatusCollector";
    }

    @Override
    public CompletableFuture<CollectorResult> poll(CollectorContext ctx) {
        MonitSourceConfig source = ctx.requiredConfig(CONFIG_KEY, MonitSourceConfig.class);
        Instant observedAt = ctx.clock().instant();

        HttpRequest request;
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(source.url()))
                    .GET()
                    .header("Accept", "application/xml")
                    .timeout(ctx.requestTimeout());
            source.basicAuthorization().ifPresent(value -> builder.header("Authorization", value));
            request = builder.build();
        } catch (IllegalArgumentException invalidUrl) {
            return CompletableFuture.completedFuture(abandon(ctx, source, "Invalid Monit URL " + source.url()));
        }

        return ctx.httpClient().sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .handle((response, error) -> {
                    if (error != null) {
                        return abandon(ctx, source, classifyFailureMessage(source.url(), error));
                    }
                    if (response.statusCode() >= 400) {
                        return abandon(ctx, source, "HTTP status " + response.statusCode() + " from " + source.url());
                    }
                    MonitStatusDocument document = MonitStatusParser.parse(response.body());
                    if (!document.valid()) {
                        return abandon(ctx, source, document.error());
                    }
                    return persist(ctx, document, observedAt);
                });
    }

    private CollectorResult persist(CollectorContext ctx, MonitStatusDocument document, Instant observedAt) {
        int persisted = 0;
        int skipped = 0;
        for (String rejected : document.rejected()) {
            skipped++;
            LOGGER.warning("Skipping malformed Monit service entry: " + rejected);
            ctx.eventBus().publish(new AlertRaised(
                    ctx.clock().instant(),
                    "input",
                    "Malformed Monit service entry: " + rejected,
                    Map.of("collector", name())
            ));
        }
        for (MonitServiceEntry entry : document.services()) {
            try {
                ctx.snapshotStore().append(new Snapshot(entry.name(), observedAt, entry.status(), entry.payload()));
                persisted++;
            } catch (RuntimeException storeError) {
                skipped++;
                LOGGER.log(Level.WARNING, "Failed storing snapshot for " + entry.name(), storeError);
                ctx.eventBus().publish(new AlertRaised(
                        ctx.clock().instant(),
                        "store",
                        "Failed storing snapshot for " + entry.name() + ": " + rootMessage(storeError),
                        Map.of("collector", name(), "service", entry.name())
                ));
            }
        }
        ctx.eventBus().publish(new SnapshotsIngested(ctx.clock().instant(), persisted, skipped));

        Map<String, Object> stats = new HashMap<>();
        stats.put("services", document.services().size() + document.rejected().size());
        stats.put("persisted", persisted);
        stats.put("skipped", skipped);
        if (persisted == 0 && skipped > 0) {
            return CollectorResult.failure("No Monit services persisted", stats);
        }
        return CollectorResult.success("Ingested " + persisted + " services", stats);
    }

    private CollectorResult abandon(CollectorContext ctx, MonitSourceConfig source, String message) {
        LOGGER.warning("Abandoning Monit poll: " + message);
        ctx.eventBus().publish(new AlertRaised(
                ctx.clock().instant(),
                "source",
                message,
                Map.of("collector", name(), "url", source.url())
        ));
        return CollectorResult.failure(message, Map.of("persisted", 0));
    }

    private String classifyFailureMessage(String url, Throwable error) {
        Throwable root = rootCause(error);
        String rootText = rootMessage(root);
        String lowered = rootText.toLowerCase(Locale.ROOT);
        if (root instanceof UnknownHostException || lowered.contains("unknown host") || lowered.contains("not known")) {
            return "DNS/unknown host while polling " + url + ": " + rootText;
        }
        if (root instanceof TimeoutException || lowered.contains("timed out")) {
            return "Request timed out while polling " + url;
        }
        return "Monit unreachable at " + url + ": " + rootText;
    }

    private static Throwable rootCause(Throwable throwable) {
        Throwable current = throwable;
        while (current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = rootCause(throwable);
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
