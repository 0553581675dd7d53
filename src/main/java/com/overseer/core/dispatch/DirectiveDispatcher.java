package com.overseer.core.dispatch;

import com.overseer.core.events.EventPublisher;
import com.overseer.core.events.OverseerEvent;
import com.overseer.core.metrics.OverseerMetrics;
import com.overseer.core.model.Directive;
import com.overseer.core.model.Priority;
import com.overseer.core.registry.Target;
import com.overseer.core.registry.TargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Builds and delivers directives to a resolved target.
 *
 * <p>Delivery paths, in order of preference:
 * <ol>
 *   <li>the configured {@link DirectiveManager}, with the Overseer as requester</li>
 *   <li>the target itself, when it is {@link Dispatchable}; the directive is built locally
 *       and handed over for immediate execution</li>
 * </ol>
 *
 * <p>The delegate call is the only variable-latency operation in the engine. It runs on the
 * dispatch executor and is cancelled when the deadline passes. Faults are returned as a
 * {@link DispatchResult}, never thrown. There is no retry.
 */
public class DirectiveDispatcher {

    private static final Logger log = LoggerFactory.getLogger(DirectiveDispatcher.class);

    private final String overseerId;
    private final TargetRegistry registry;
    private final DirectiveManager manager;
    private final EventPublisher events;
    private final ExecutorService executor;
    private final Duration timeout;
    private final OverseerMetrics metrics;
    private final Clock clock;

    public DirectiveDispatcher(String overseerId,
                               TargetRegistry registry,
                               DirectiveManager manager,
                               EventPublisher events,
                               ExecutorService executor,
                               Duration timeout,
                               OverseerMetrics metrics,
                               Clock clock) {
        this.overseerId = overseerId;
        this.registry = registry;
        this.manager = manager;
        this.events = events;
        this.executor = executor;
        this.timeout = timeout;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DispatchResult dispatch(String targetId, String title, String body,
                                   Priority priority, Map<String, Object> context) {
        long started = System.nanoTime();
        DispatchResult result = doDispatch(targetId, title, body, priority, context);
        if (metrics != null) {
            metrics.recordDispatch(result.dispatched() ? "dispatched" : result.error().name().toLowerCase(Locale.ROOT),
                    Duration.ofNanos(System.nanoTime() - started));
        }
        return result;
    }

    private DispatchResult doDispatch(String targetId, String title, String body,
                                      Priority priority, Map<String, Object> context) {
        Priority effectivePriority = priority == null ? Priority.HIGH : priority;
        Map<String, Object> effectiveContext = context == null ? Map.of() : context;
        Optional<Target> target = registry.byId(targetId);
        String targetName = target.map(Target::name).orElse(targetId);

        if (manager != null) {
            log.info("Issuing directive '{}' to {} via directive manager", title, targetName);
            DelegateOutcome<Directive> outcome = callWithDeadline(() ->
                    manager.issue(overseerId, targetId, title, body, effectivePriority, effectiveContext));
            if (outcome.failure() != null) {
                return outcome.failure();
            }
            Directive directive = outcome.value();
            if (directive == null) {
                return DispatchResult.failure(DispatchError.DELEGATE_FAILURE,
                        "Failed to send directive: directive manager returned no directive");
            }
            events.publish(OverseerEvent.directiveGiven(overseerId, directive, targetName, clock.instant()));
            return DispatchResult.success(directive, "Directive sent: " + directive.id()
                    + "\nTitle: " + title
                    + "\nStatus: " + directive.status());
        }

        if (target.isEmpty()) {
            log.warn("No target registered with id {}", targetId);
            return DispatchResult.failure(DispatchError.NOT_FOUND, "Target not found: " + targetId);
        }

        if (target.get() instanceof Dispatchable receiver) {
            Directive directive;
            try {
                directive = Directive.create(overseerId, targetId, title, body,
                        effectivePriority, effectiveContext, clock.instant());
            } catch (RuntimeException e) {
                log.warn("Could not build directive for {}: {}", targetName, e.getMessage(), e);
                return DispatchResult.failure(DispatchError.DELEGATE_FAILURE,
                        "Failed to send directive: " + e.getMessage());
            }
            log.info("Handing directive {} '{}' directly to {}", directive.id(), title, targetName);
            DelegateOutcome<Void> outcome = callWithDeadline(() -> {
                receiver.receiveDirective(directive, true);
                return null;
            });
            if (outcome.failure() != null) {
                return outcome.failure();
            }
            events.publish(OverseerEvent.directiveGiven(overseerId, directive, targetName, clock.instant()));
            return DispatchResult.success(directive, "Directive sent to " + targetName + ": " + title);
        }

        log.warn("No dispatch path for target {}", targetId);
        return DispatchResult.failure(DispatchError.NO_DISPATCH_PATH,
                "No directive manager configured and no target that accepts directives found for " + targetName);
    }

    private <T> DelegateOutcome<T> callWithDeadline(Callable<T> call) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch executor rejected directive: {}", e.getMessage());
            return DelegateOutcome.failed(DispatchError.DELEGATE_FAILURE,
                    "Failed to send directive: dispatcher is not accepting work");
        }
        try {
            return DelegateOutcome.of(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Directive delegate did not respond within {}ms", timeout.toMillis());
            return DelegateOutcome.failed(DispatchError.TIMEOUT,
                    "Failed to send directive: no response within " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Directive delegate failed: {}", cause.getMessage(), cause);
            return DelegateOutcome.failed(DispatchError.DELEGATE_FAILURE,
                    "Failed to send directive: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return DelegateOutcome.failed(DispatchError.DELEGATE_FAILURE,
                    "Failed to send directive: interrupted");
        }
    }

    private record DelegateOutcome<T>(T value, DispatchResult failure) {

        static <T> DelegateOutcome<T> of(T value) {
            return new DelegateOutcome<>(value, null);
        }

        static <T> DelegateOutcome<T> failed(DispatchError error, String message) {
            return new DelegateOutcome<>(null, DispatchResult.failure(error, message));
        }
    }
}
