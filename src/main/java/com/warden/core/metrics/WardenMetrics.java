package com.warden.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for jobs, events, egress and routines.
 */
@Service
public class WardenMetrics {

    private final MeterRegistry registry;

    public WardenMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobCreated(String mode) {
        Counter.builder("warden.jobs.created")
                .tag("mode", mode)
                .register(registry)
                .increment();
    }

    public void recordTransition(String toState) {
        Counter.builder("warden.jobs.transitions")
                .tag("to", toState)
                .register(registry)
                .increment();
    }

    public void recordEventIngested(String eventType) {
        Counter.builder("warden.events.ingested")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    /**
     * Records events a slow subscriber skipped because the ring buffer overwrote them.
     */
    public void recordSubscriberLag(long skipped) {
        Counter.builder("warden.events.subscriber_lag")
                .description("Events skipped by subscribers that fell behind the live buffer")
                .register(registry)
                .increment(skipped);
    }

    public void recordProvisioning(boolean success, long ms) {
        Timer.builder("warden.sandbox.provision.duration")
                .tag("success", String.valueOf(success))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param decision "allowed", "denied", "unauthenticated" or "error"
     */
    public void recordEgressDecision(String decision, boolean credentialInjected) {
        Counter.builder("warden.egress.requests")
                .tag("decision", decision)
                .tag("credential", String.valueOf(credentialInjected))
                .register(registry)
                .increment();
    }

    public void recordRoutineFire(String triggerType) {
        Counter.builder("warden.routines.fired")
                .tag("trigger", triggerType)
                .register(registry)
                .increment();
    }

    public void recordRoutineSkip(String reason) {
        Counter.builder("warden.routines.skipped")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
