package com.monitintel.service.api;

import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.AlertRaised;
import com.monitintel.core.events.CycleCompleted;
import com.monitintel.core.events.CycleSkipped;
import com.monitintel.core.events.CycleStarted;
import com.monitintel.core.events.Event;
import com.monitintel.core.events.FailureClassified;
import com.monitintel.core.state.TransitionOutcome;
import com.monitintel.service.store.EventCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-memory cycle statistics for {@code /api/diagnostics}, fed from the event bus.
 */
public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsEmittedTotal = new LongAdder();
    private final LongAdder cyclesCompleted = new LongAdder();
    private final LongAdder cyclesFailed = new LongAdder();
    private final LongAdder cyclesSkipped = new LongAdder();
    private final Map<TransitionOutcome, LongAdder> outcomeCounts = new EnumMap<>(TransitionOutcome.class);
    private final ArrayDeque<Instant> recentEventTimestamps = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final AtomicReference<CycleStatus> lastCycle = new AtomicReference<>(CycleStatus.empty());
    private final AtomicReference<AlertRaised> lastAlert = new AtomicReference<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this(clock);
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(CycleStarted.class, this::onCycleStarted);
        eventBus.subscribe(CycleCompleted.class, this::onCycleCompleted);
        eventBus.subscribe(CycleSkipped.class, event -> cyclesSkipped.increment());
        eventBus.subscribe(FailureClassified.class, event -> outcomeCounts.get(event.outcome()).increment());
        eventBus.subscribe(AlertRaised.class, lastAlert::set);
    }

    private DiagnosticsTracker(Clock clock) {
        this.clock = clock;
        for (TransitionOutcome outcome : TransitionOutcome.values()) {
            outcomeCounts.put(outcome, new LongAdder());
        }
    }

    public static DiagnosticsTracker empty() {
        return new DiagnosticsTracker(Clock.systemUTC());
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> diagnostics = new HashMap<>();
        diagnostics.put("lastCycle", lastCycle.get().toMap());
        diagnostics.put("cyclesCompleted", cyclesCompleted.longValue());
        diagnostics.put("cyclesFailed", cyclesFailed.longValue());
        diagnostics.put("cyclesSkipped", cyclesSkipped.longValue());
        Map<String, Long> outcomes = new HashMap<>();
        outcomeCounts.forEach((outcome, count) -> outcomes.put(outcome.name(), count.longValue()));
        diagnostics.put("outcomes", outcomes);
        diagnostics.put("eventsEmittedTotal", eventsEmittedTotal.longValue());
        diagnostics.put("recentEventsPerMinute", recentEventsPerMinute());
        AlertRaised alert = lastAlert.get();
        diagnostics.put("lastAlert", alert == null ? null : Map.of(
                "timestamp", alert.timestamp().toString(),
                "category", alert.category(),
                "message", alert.message()
        ));
        return diagnostics;
    }

    private void onAnyEvent(Event event) {
        eventsEmittedTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEventTimestamps.addLast(now);
            trimOld(now);
        }
    }

    private int recentEventsPerMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEventTimestamps.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEventTimestamps.isEmpty() && recentEventTimestamps.peekFirst().isBefore(threshold)) {
            recentEventTimestamps.removeFirst();
        }
    }

    private void onCycleStarted(CycleStarted event) {
        lastCycle.updateAndGet(current -> current.started(event.cycleNumber(), event.timestamp()));
    }

    private void onCycleCompleted(CycleCompleted event) {
        cyclesCompleted.increment();
        if (!event.success()) {
            cyclesFailed.increment();
        }
        lastCycle.updateAndGet(current -> current.completed(event));
    }

    private record CycleStatus(
            Long cycleNumber,
            Instant startedAt,
            Instant completedAt,
            Long durationMillis,
            Boolean success,
            Integer criticalServices
    ) {
        private static CycleStatus empty() {
            return new CycleStatus(null, null, null, null, null, null);
        }

        private CycleStatus started(long number, Instant at) {
            return new CycleStatus(number, at, null, null, null, null);
        }

        private CycleStatus completed(CycleCompleted event) {
            return new CycleStatus(event.cycleNumber(), startedAt, event.timestamp(), event.durationMillis(),
                    event.success(), event.criticalServices());
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("cycleNumber", cycleNumber);
            map.put("startedAt", startedAt == null ? null : startedAt.toString());
            map.put("completedAt", completedAt == null ? null : completedAt.toString());
            map.put("durationMillis", durationMillis);
            map.put("success", success);
            map.put("criticalServices", criticalServices);
            return map;
        }
    }
}
