package com.overseer.core.metrics;

import com.overseer.core.classify.IntentType;
import com.overseer.core.model.ApprovalKind;
import com.overseer.core.model.ApprovalStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the Overseer.
 */
public class OverseerMetrics {

    private final MeterRegistry registry;

    public OverseerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordIntent(IntentType type) {
        Counter.builder("overseer.intents.total")
                .tag("type", type.name())
                .register(registry)
                .increment();
    }

    /**
     * @param result "dispatched" or the lower-cased failure category
     */
    public void recordDispatch(String result, Duration elapsed) {
        Counter.builder("overseer.directives.total")
                .tag("result", result)
                .register(registry)
                .increment();
        Timer.builder("overseer.dispatch.duration")
                .register(registry)
                .record(elapsed);
    }

    public void recordApprovalFiled(ApprovalKind kind) {
        Counter.builder("overseer.approvals.filed")
                .tag("kind", kind.name())
                .register(registry)
                .increment();
    }

    public void recordApprovalDecided(ApprovalStatus status) {
        Counter.builder("overseer.approvals.decided")
                .tag("decision", status.name())
                .register(registry)
                .increment();
    }

    public void incrementEscalations() {
        Counter.builder("overseer.escalations.total")
                .description("Escalations received from crews")
                .register(registry)
                .increment();
    }

    public void incrementReports() {
        Counter.builder("overseer.reports.total")
                .register(registry)
                .increment();
    }
}
