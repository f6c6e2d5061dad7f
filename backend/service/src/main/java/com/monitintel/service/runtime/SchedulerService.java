package com.monitintel.service.runtime;

import com.monitintel.core.bus.EventBus;
import com.monitintel.core.events.CycleSkipped;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fires the monitor cycle at a fixed rate. The cycle never overlaps itself: a tick that finds the
 * previous cycle still running is skipped and published as {@link CycleSkipped}.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final Runnable cycle;
    private final Duration interval;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final AtomicBoolean running = new AtomicBoolean();
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor(
            runnable -> daemon(runnable, "monitor-timer"));
    private final ExecutorService cycleExecutor = Executors.newSingleThreadExecutor(
            runnable -> daemon(runnable, "monitor-cycle"));

    public SchedulerService(Runnable cycle, Duration interval, EventBus eventBus, Clock clock) {
        this(cycle, interval, eventBus, clock, 1_000);
    }

    SchedulerService(Runnable cycle, Duration interval, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.cycle = Objects.requireNonNull(cycle, "cycle is required");
        this.interval = Objects.requireNonNull(interval, "interval is required");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        long intervalMillis = Math.max(minIntervalMillis, interval.toMillis());
        LOGGER.info("Scheduling monitor cycle every " + intervalMillis + "ms");
        timerExecutor.scheduleAtFixedRate(this::tick, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Submits a cycle unless one is already running.
     *
     * @return false when the tick was skipped
     */
    boolean tick() {
        if (!running.compareAndSet(false, true)) {
            skip();
            return false;
        }
        try {
            cycleExecutor.submit(() -> {
                try {
                    runGuarded();
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException rejected) {
            running.set(false);
            LOGGER.log(Level.WARNING, "Monitor cycle rejected by executor", rejected);
            return false;
        }
        return true;
    }

    /**
     * Runs one cycle on the calling thread, honouring the same non-overlap guard.
     *
     * @return false when another cycle was already running
     */
    public boolean runOnce() {
        if (!running.compareAndSet(false, true)) {
            skip();
            return false;
        }
        try {
            runGuarded();
            return true;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public void shutdown() {
        timerExecutor.shutdown();
        cycleExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!cycleExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                LOGGER.warning("Monitor cycle still running at shutdown; interrupting");
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void runGuarded() {
        try {
            cycle.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Monitor cycle failed; next tick will retry", e);
        }
    }

    private void skip() {
        LOGGER.warning("Previous monitor cycle still running; skipping tick");
        eventBus.publish(new CycleSkipped(clock.instant(), "previous cycle still running"));
    }

    private static Thread daemon(Runnable runnable, String name) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        return thread;
    }
}
