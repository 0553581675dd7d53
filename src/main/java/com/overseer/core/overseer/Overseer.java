package com.overseer.core.overseer;

import com.overseer.core.classify.Intent;
import com.overseer.core.classify.IntentClassifier;
import com.overseer.core.dispatch.DirectiveDispatcher;
import com.overseer.core.dispatch.DirectiveManager;
import com.overseer.core.dispatch.DispatchResult;
import com.overseer.core.events.EventPublisher;
import com.overseer.core.events.EventSink;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.ledger.ApprovalLedger;
import com.overseer.core.logging.MdcContext;
import com.overseer.core.messages.MessageLog;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.ApprovalKind;
import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Decision;
import com.overseer.core.model.Escalation;
import com.overseer.core.model.Message;
import com.overseer.core.model.MessageDirection;
import com.overseer.core.model.MessageKind;
import com.overseer.core.model.Priority;
import com.overseer.core.model.Report;
import com.overseer.core.model.ReportPriority;
import com.overseer.core.registry.OverseerChannel;
import com.overseer.core.registry.Target;
import com.overseer.core.registry.TargetDirectory;
import com.overseer.core.registry.TargetRegistry;
import com.overseer.core.snapshot.OverseerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * The single human arbiter of an organisation.
 *
 * <p>Receives free-text input, classifies it and routes it to the {@link DirectiveDispatcher},
 * the {@link ApprovalLedger} or the status query path. Crews report and escalate back through
 * the {@link OverseerChannel} methods. The Overseer owns its ledger and message log; registered
 * targets are only referenced.
 *
 * <p>Text operations are total: faults from collaborators are logged and answered with a
 * failure message instead of being thrown.
 *
 * <p>When the builder was not given a dispatch executor the Overseer creates its own and
 * shuts it down in {@link #close()}. An injected executor belongs to the caller.
 */
public class Overseer implements OverseerChannel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Overseer.class);

    static final String NO_PENDING_REQUEST = "No pending approval request found.";

    static final String USAGE = """
            Message received. Use:
            - @target: instruction - to issue a directive
            - status? - for a status overview
            - approve/reject [#ref] - to decide on approval requests""";

    private final String id;
    private final String name;
    private final TargetRegistry registry;
    private final ApprovalLedger ledger;
    private final MessageLog messageLog;
    private final IntentClassifier classifier;
    private final DirectiveDispatcher dispatcher;
    private final EventPublisher events;
    private final OverseerCallbacks callbacks;
    private final TargetDirectory directory;
    private final OverseerMetrics metrics;
    private final OverseerProperties properties;
    private final Clock clock;
    private final ExecutorService ownedExecutor;

    private Overseer(Builder builder, String id, DirectiveDispatcher dispatcher, MessageLog messageLog,
                     ApprovalLedger ledger, EventPublisher events, ExecutorService ownedExecutor) {
        this.id = id;
        this.name = builder.properties.getName();
        this.registry = builder.registry;
        this.ledger = ledger;
        this.messageLog = messageLog;
        this.classifier = builder.classifier;
        this.dispatcher = dispatcher;
        this.events = events;
        this.callbacks = builder.callbacks;
        this.directory = builder.directory;
        this.metrics = builder.metrics;
        this.properties = builder.properties;
        this.clock = builder.clock;
        this.ownedExecutor = ownedExecutor;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String overseerId() {
        return id;
    }

    public String name() {
        return name;
    }

    // -- Inbound text -------------------------------------------------------

    /**
     * Process one line of Overseer input and return the reply.
     * <p>
     * The raw text is logged before classification so the audit trail always has it.
     */
    public String handle(String text) {
        try (var mdc = MdcContext.overseer(id)) {
            messageLog.append(MessageDirection.OUTBOUND, MessageKind.DIRECTIVE, text, null, Map.of());

            Intent intent = classifier.classify(text);
            log.debug("Classified input as {}", intent.type());
            if (metrics != null) {
                metrics.recordIntent(intent.type());
            }

            return switch (intent.type()) {
                case DIRECTIVE -> directiveFromText(intent);
                case DECISION -> decisionFromText(intent);
                case QUERY -> answerQuery();
                case GENERAL -> USAGE;
            };
        } catch (Exception e) {
            log.warn("Failed to process input: {}", e.getMessage(), e);
            return "Failed to process message: " + e.getMessage();
        }
    }

    private String directiveFromText(Intent intent) {
        Optional<String> targetId = resolveTarget(intent.target());
        if (targetId.isEmpty()) {
            List<String> names = registry.names();
            return "Could not find '" + intent.target() + "'. Registered targets: "
                    + (names.isEmpty() ? "none" : String.join(", ", names));
        }
        String body = intent.body();
        String title = body.length() <= properties.getDirective().getTitleMaxLength()
                ? body
                : body.substring(0, properties.getDirective().getTitleMaxLength());
        return issueDirective(targetId.get(), title, body,
                properties.getDirective().getDefaultPriority(), Map.of());
    }

    private String decisionFromText(Intent intent) {
        Optional<ApprovalRequest> found = ledger.resolveRef(intent.ref());
        if (found.isEmpty()) {
            return NO_PENDING_REQUEST;
        }
        ApprovalRequest request = found.get();
        boolean approve = intent.decision() == Decision.APPROVE;
        boolean decided = approve
                ? approve(request.id(), "Approved via chat")
                : reject(request.id(), "Rejected via chat");
        if (!decided) {
            return "Request " + request.id() + " was already decided ("
                    + ledger.get(request.id()).map(r -> r.status().name().toLowerCase(Locale.ROOT)).orElse("unknown") + ").";
        }
        return (approve ? "Approved: " : "Rejected: ") + preview(request.description());
    }

    private String answerQuery() {
        OverseerSummary summary = summary();
        var lines = new ArrayList<String>();
        lines.add("=== Organisation Status ===");
        lines.add("Unread reports: " + summary.unreadReports());
        lines.add("Urgent reports: " + summary.urgentReports());
        lines.add("Pending approvals: " + summary.pendingApprovals());
        lines.add("Registered targets: " + summary.registeredTargets());

        List<ApprovalRequest> pending = ledger.pending();
        if (!pending.isEmpty()) {
            lines.add("");
            lines.add("=== Pending Approvals ===");
            pending.stream()
                    .limit(properties.getQuery().getPendingPreviewLimit())
                    .forEach(r -> lines.add("- [" + r.id() + "] " + r.kind().name().toLowerCase(Locale.ROOT)
                            + ": " + preview(r.description())));
        }
        return String.join("\n", lines);
    }

    private Optional<String> resolveTarget(String targetName) {
        Optional<String> registered = registry.resolve(targetName);
        if (registered.isPresent() || directory == null) {
            return registered;
        }
        try {
            return directory.findIdByName(targetName);
        } catch (Exception e) {
            log.warn("Target directory lookup for '{}' failed: {}", targetName, e.getMessage());
            return Optional.empty();
        }
    }

    // -- Directives ---------------------------------------------------------

    /**
     * Issue a directive to a crew or agent and return the confirmation or failure text.
     */
    public String issueDirective(String targetId, String title, String body,
                                 Priority priority, Map<String, Object> context) {
        return dispatch(targetId, title, body, priority, context).message();
    }

    public DispatchResult dispatch(String targetId, String title, String body,
                                   Priority priority, Map<String, Object> context) {
        try (var mdc = MdcContext.target(id, targetId)) {
            DispatchResult result = dispatcher.dispatch(targetId, title, body, priority, context);
            if (result.dispatched()) {
                log.info("Directive {} dispatched to {}", result.directive().id(), targetId);
            } else {
                log.warn("Directive to {} not dispatched ({}): {}", targetId, result.error(), result.message());
            }
            return result;
        }
    }

    // -- Approvals ----------------------------------------------------------

    /**
     * File an approval request. Called by crews that need the Overseer's sign-off.
     * Detail values of other types than the supported ones are stored as text.
     */
    @Override
    public ApprovalRequest requestApproval(ApprovalKind kind, String description, String requesterId,
                                           String requesterName, Map<String, Object> details) {
        ApprovalRequest request = ledger.file(kind, description, requesterId, requesterName, details);
        try (var mdc = MdcContext.request(id, request.id().toString())) {
            if (metrics != null) {
                metrics.recordApprovalFiled(kind);
            }
            invoke(callbacks.onApprovalRequired(), request, "onApprovalRequired");
            messageLog.append(MessageDirection.INBOUND, MessageKind.NOTIFICATION,
                    "Approval required (" + kind.name().toLowerCase(Locale.ROOT) + "): " + description,
                    requesterId, Map.of("requestId", request.id().toString()));
            events.publish(OverseerEvent.requestFiled(id, request));
            return request;
        }
    }

    public boolean approve(UUID requestId, String note) {
        return decide(requestId, Decision.APPROVE, note);
    }

    public boolean reject(UUID requestId, String note) {
        return decide(requestId, Decision.REJECT, note);
    }

    public boolean amend(UUID requestId, String note) {
        return decide(requestId, Decision.AMEND, note);
    }

    /**
     * @return false if the request is unknown or was already decided
     */
    public boolean decide(UUID requestId, Decision decision, String note) {
        Optional<ApprovalRequest> decided = ledger.decide(requestId, decision, note);
        decided.ifPresent(request -> {
            if (metrics != null) {
                metrics.recordApprovalDecided(request.status());
            }
            events.publish(OverseerEvent.requestDecided(id, request));
        });
        return decided.isPresent();
    }

    /** Pending requests, oldest first. */
    public List<ApprovalRequest> pendingApprovals() {
        return ledger.pending();
    }

    public Optional<ApprovalRequest> approval(UUID requestId) {
        return ledger.get(requestId);
    }

    // -- Target registration ------------------------------------------------

    public void registerTarget(String targetName, Target target) {
        registry.register(targetName, target, this);
    }

    public boolean unregisterTarget(String targetName) {
        return registry.unregister(targetName);
    }

    public List<String> targetNames() {
        return registry.names();
    }

    // -- Inbound reports and escalations ------------------------------------

    @Override
    public void receiveReport(Report report) {
        var context = new LinkedHashMap<String, Object>();
        context.put("reportId", report.id() == null ? "" : report.id().toString());
        context.put("priority", report.priority().name());
        if (report.title() != null) {
            context.put("title", report.title());
        }
        messageLog.append(MessageDirection.INBOUND, MessageKind.REPORT,
                report.summary() != null ? report.summary() : String.valueOf(report.title()),
                report.fromId(), context);
        String from = report.fromName() != null ? report.fromName() : report.fromId();
        if (report.isUrgent()) {
            log.warn("Urgent report received from {}: {}", from, report.title());
        } else {
            log.info("Report received from {} ({})", from, report.priority());
        }
        if (metrics != null) {
            metrics.incrementReports();
        }
        invoke(callbacks.onReport(), report, "onReport");
        events.publish(OverseerEvent.reportReceived(id, report, clock.instant()));
    }

    /**
     * Log the escalation and file an {@link ApprovalKind#ESCALATION} request for it.
     * Escalations are never approved automatically.
     */
    @Override
    public void receiveEscalation(Escalation escalation) {
        String reason = escalation.reason() != null ? escalation.reason() : String.valueOf(escalation);
        messageLog.append(MessageDirection.INBOUND, MessageKind.NOTIFICATION, "Escalation: " + reason,
                escalation.sourceId(),
                Map.of("escalationId", escalation.id() == null ? "" : escalation.id().toString()));
        log.warn("Escalation from {}: {}", escalation.sourceId(), reason);
        if (metrics != null) {
            metrics.incrementEscalations();
        }
        invoke(callbacks.onEscalation(), escalation, "onEscalation");

        String requesterId = escalation.sourceId() != null ? escalation.sourceId() : UUID.randomUUID().toString();
        ApprovalRequest request = requestApproval(ApprovalKind.ESCALATION, reason, requesterId,
                escalation.sourceType(), Map.of("escalation", escalation.toString()));
        events.publish(OverseerEvent.escalationReceived(id, escalation, request));
    }

    // -- Queries ------------------------------------------------------------

    public OverseerSummary summary() {
        List<Message> unreadReports = messageLog.unread(MessageKind.REPORT);
        int urgent = (int) unreadReports.stream()
                .filter(m -> ReportPriority.URGENT.name().equals(m.context().get("priority")))
                .count();
        return new OverseerSummary(unreadReports.size(), urgent, ledger.pendingCount(),
                messageLog.size(), registry.size());
    }

    /**
     * Report messages, newest first.
     *
     * @param unreadOnly only reports not yet marked read
     * @param limit      maximum number of reports returned
     */
    public List<Message> reports(boolean unreadOnly, int limit) {
        var reports = new ArrayList<>(unreadOnly
                ? messageLog.unread(MessageKind.REPORT)
                : messageLog.messages(MessageKind.REPORT));
        Collections.reverse(reports);
        return reports.stream().limit(Math.max(0, limit)).toList();
    }

    public boolean markRead(UUID messageId) {
        return messageLog.markRead(messageId);
    }

    public List<Message> messages() {
        return messageLog.messages();
    }

    // -- Snapshots ----------------------------------------------------------

    public OverseerSnapshot snapshot() {
        return new OverseerSnapshot(id, clock.instant(), ledger.all(), messageLog.messages());
    }

    /**
     * Replace the ledger and message log with the snapshot contents.
     * Registered targets are not part of a snapshot and stay as they are.
     */
    public void restore(OverseerSnapshot snapshot) {
        if (!id.equals(snapshot.overseerId())) {
            log.warn("Restoring snapshot taken by Overseer {} into {}", snapshot.overseerId(), id);
        }
        ledger.restore(snapshot.requests());
        messageLog.restore(snapshot.messages());
    }

    /**
     * Shuts down the dispatch executor if this Overseer created it. Idempotent.
     */
    @Override
    public void close() {
        if (ownedExecutor != null && !ownedExecutor.isShutdown()) {
            log.info("Shutting down dispatch executor of Overseer {}", id);
            ownedExecutor.shutdownNow();
        }
    }

    private String preview(String text) {
        int max = properties.getQuery().getDescriptionPreviewLength();
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }

    private <T> void invoke(Consumer<T> callback, T value, String callbackName) {
        if (callback == null) {
            return;
        }
        try {
            callback.accept(value);
        } catch (Exception e) {
            log.warn("Callback {} failed: {}", callbackName, e.getMessage(), e);
        }
    }

    /**
     * Assembles an Overseer and the stores it owns.
     */
    public static class Builder {

        private OverseerProperties properties = new OverseerProperties();
        private TargetRegistry registry = new TargetRegistry();
        private IntentClassifier classifier = new IntentClassifier();
        private EventSink eventSink;
        private OverseerCallbacks callbacks = OverseerCallbacks.none();
        private DirectiveManager directiveManager;
        private TargetDirectory directory;
        private OverseerMetrics metrics;
        private ExecutorService dispatchExecutor;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder properties(OverseerProperties properties) { this.properties = properties; return this; }
        public Builder registry(TargetRegistry registry) { this.registry = registry; return this; }
        public Builder classifier(IntentClassifier classifier) { this.classifier = classifier; return this; }
        public Builder eventSink(EventSink eventSink) { this.eventSink = eventSink; return this; }
        public Builder directiveManager(DirectiveManager directiveManager) { this.directiveManager = directiveManager; return this; }
        public Builder targetDirectory(TargetDirectory directory) { this.directory = directory; return this; }
        public Builder metrics(OverseerMetrics metrics) { this.metrics = metrics; return this; }
        public Builder dispatchExecutor(ExecutorService executor) { this.dispatchExecutor = executor; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }

        public Builder callbacks(OverseerCallbacks callbacks) {
            this.callbacks = callbacks == null ? OverseerCallbacks.none() : callbacks;
            return this;
        }

        public Overseer build() {
            String id = properties.hasId() ? properties.getId() : UUID.randomUUID().toString();
            ExecutorService owned = null;
            ExecutorService executor = dispatchExecutor;
            if (executor == null) {
                owned = Executors.newFixedThreadPool(Math.max(1, properties.getDispatch().getThreads()), r -> {
                    Thread t = new Thread(r, "overseer-dispatch");
                    t.setDaemon(true);
                    return t;
                });
                executor = owned;
            }
            var events = new EventPublisher(eventSink);
            var dispatcher = new DirectiveDispatcher(id, registry, directiveManager, events, executor,
                    Duration.ofSeconds(properties.getDispatch().getTimeoutSeconds()), metrics, clock);
            var messageLog = new MessageLog(clock, callbacks.onMessage());
            var ledger = new ApprovalLedger(clock);
            log.info("Overseer '{}' ({}) ready, directive manager {}", properties.getName(), id,
                    directiveManager != null ? "configured" : "not configured");
            return new Overseer(this, id, dispatcher, messageLog, ledger, events, owned);
        }
    }
}
