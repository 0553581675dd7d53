package com.overseer.core.metrics;

import com.overseer.core.classify.IntentType;
import com.overseer.core.model.ApprovalKind;
import com.overseer.core.model.ApprovalStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OverseerMetricsTest {

    private SimpleMeterRegistry registry;
    private OverseerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new OverseerMetrics(registry);
    }

    @Test
    @DisplayName("recordIntent counts by intent type")
    void recordIntent() {
        metrics.recordIntent(IntentType.DIRECTIVE);
        metrics.recordIntent(IntentType.DIRECTIVE);
        metrics.recordIntent(IntentType.QUERY);

        assertEquals(2.0, registry.find("overseer.intents.total").tag("type", "DIRECTIVE").counter().count());
        assertEquals(1.0, registry.find("overseer.intents.total").tag("type", "QUERY").counter().count());
    }

    @Test
    @DisplayName("recordDispatch counts result and times the call")
    void recordDispatch() {
        metrics.recordDispatch("dispatched", Duration.ofMillis(20));
        metrics.recordDispatch("timeout", Duration.ofMillis(500));

        var dispatched = registry.find("overseer.directives.total").tag("result", "dispatched").counter();
        var timedOut = registry.find("overseer.directives.total").tag("result", "timeout").counter();
        var timer = registry.find("overseer.dispatch.duration").timer();

        assertNotNull(dispatched);
        assertNotNull(timedOut);
        assertEquals(1.0, dispatched.count());
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("approval counters are tagged by kind and decision")
    void approvalCounters() {
        metrics.recordApprovalFiled(ApprovalKind.BUDGET);
        metrics.recordApprovalDecided(ApprovalStatus.REJECTED);

        assertEquals(1.0, registry.find("overseer.approvals.filed").tag("kind", "BUDGET").counter().count());
        assertEquals(1.0, registry.find("overseer.approvals.decided").tag("decision", "REJECTED").counter().count());
    }

    @Test
    @DisplayName("escalation and report counters increment")
    void escalationAndReportCounters() {
        metrics.incrementEscalations();
        metrics.incrementEscalations();
        metrics.incrementReports();

        assertEquals(2.0, registry.find("overseer.escalations.total").counter().count());
        assertEquals(1.0, registry.find("overseer.reports.total").counter().count());
    }
}
