package com.platform.schedulerjob.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for application metrics: reconciliation outcomes, remote call
 * latencies and error counts.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }
    
    /**
     * Record the outcome of one reconciliation action (apply, read or delete).
     */
    public void recordReconciliation(String action, String outcome, long durationMs) {
        incrementCounter("scheduler.reconciliation.total", "action", action, "outcome", outcome);
        
        String timerKey = "reconciliation." + action;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("scheduler.reconciliation.latency")
                .tag("action", action)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(durationMs));
        
        log.debug("Recorded reconciliation {} -> {} in {}ms", action, outcome, durationMs);
    }
    
    /**
     * Record latency and status of a call to the scheduler service.
     */
    public void recordRemoteCall(String operation, int statusCode, long latencyMs) {
        String timerKey = "remote." + operation;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("scheduler.remote.latency")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));
        timer.record(Duration.ofMillis(latencyMs));
        
        incrementCounter("scheduler.remote.calls", "operation", operation, "status", String.valueOf(statusCode));
    }
    
    /**
     * Record a configuration rejected before any remote call.
     */
    public void recordValidationFailure(String stage, int violations) {
        incrementCounter("scheduler.validation.failures", "stage", stage);
        log.debug("Recorded {} validation failure with {} violations", stage, violations);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
