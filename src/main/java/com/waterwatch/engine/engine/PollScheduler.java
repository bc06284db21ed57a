package com.waterwatch.engine.engine;

import com.waterwatch.engine.config.EngineConfig;
import com.waterwatch.engine.store.StorageException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduled poll loop.
 *
 * Reconciles alarm state with the record store once the application is ready,
 * then runs a poll cycle with a fixed delay between the end of one cycle and
 * the start of the next, so cycles never overlap.
 *
 * @author WaterWatch
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(prefix = "waterwatch.engine", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PollScheduler {

    private final AlarmDispatcher alarmDispatcher;
    private final EngineHealth engineHealth;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Counter cycleCounter;
    private final Counter cycleErrorCounter;
    private final Timer cycleTimer;

    public PollScheduler(AlarmDispatcher alarmDispatcher, EngineHealth engineHealth, EngineConfig engineConfig,
                         Clock clock, MeterRegistry meterRegistry) {
        this.alarmDispatcher = alarmDispatcher;
        this.engineHealth = engineHealth;
        this.clock = clock;

        this.cycleCounter = Counter.builder("waterwatch_poll_cycles_total")
                .description("Total number of poll cycles run")
                .register(meterRegistry);

        this.cycleErrorCounter = Counter.builder("waterwatch_poll_cycle_errors_total")
                .description("Total number of poll cycles that ended with an error")
                .register(meterRegistry);

        this.cycleTimer = Timer.builder("waterwatch_poll_cycle_duration_seconds")
                .description("Time spent in one poll cycle")
                .register(meterRegistry);

        log.info("PollScheduler initialized with a {}s poll interval and {} worker threads",
                engineConfig.getPollIntervalSeconds(), engineConfig.getWorkerThreads());
    }

    /**
     * Restore open alarms before the first cycle so a restart never opens a duplicate
     */
    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        try {
            alarmDispatcher.reconcile(clock.instant());
        } catch (StorageException e) {
            engineHealth.storageFailed(e.getMessage());
            log.error("Startup reconciliation failed, will retry before the next cycle: {}", e.getMessage());
        }
    }

    @Scheduled(fixedDelayString = "${waterwatch.engine.poll-interval-seconds:60}000",
            initialDelayString = "${waterwatch.engine.initial-delay-seconds:10}000")
    public void poll() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous poll cycle still running, skipping");
            return;
        }
        Timer.Sample sample = Timer.start();
        try {
            CycleReport report = alarmDispatcher.runCycle(clock.instant());
            cycleCounter.increment();
            log.info("Poll cycle completed (snapshot v{}): {}", report.getSnapshotVersion(), report.summary());
        } catch (RuntimeException e) {
            cycleErrorCounter.increment();
            log.error("Error during poll cycle: {}", e.getMessage(), e);
        } finally {
            sample.stop(cycleTimer);
            running.set(false);
        }
    }
}
