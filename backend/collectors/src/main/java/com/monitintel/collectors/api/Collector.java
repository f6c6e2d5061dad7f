package com.monitintel.collectors.api;

import java.util.concurrent.CompletableFuture;

public interface Collector {
    String name();

    CompletableFuture<CollectorResult> poll(CollectorContext ctx);
}
