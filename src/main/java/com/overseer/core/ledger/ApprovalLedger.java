package com.overseer.core.ledger;

import com.overseer.core.model.ApprovalKind;
import com.overseer.core.model.ApprovalRequest;
import com.overseer.core.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Keyed store of approval requests.
 * <p>
 * Requests start {@code PENDING} and take exactly one terminal transition; deciding an
 * already decided request is refused and leaves the first decision in place.
 * Mutations are serialised by a write lock, reads take the read lock.
 */
public class ApprovalLedger {

    private static final Logger log = LoggerFactory.getLogger(ApprovalLedger.class);

    /** Filing order: timestamp first, then the ledger's own sequence for equal timestamps. */
    static final Comparator<ApprovalRequest> FILING_ORDER =
            Comparator.comparing(ApprovalRequest::requestedAt).thenComparingLong(ApprovalRequest::sequence);

    private final Map<UUID, ApprovalRequest> requests = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long nextSequence;

    public ApprovalLedger() {
        this(Clock.systemUTC());
    }

    public ApprovalLedger(Clock clock) {
        this.clock = clock;
    }

    public ApprovalRequest file(ApprovalKind kind, String description, String requesterId,
                                String requesterName, Map<String, Object> details) {
        lock.writeLock().lock();
        try {
            var request = ApprovalRequest.pending(kind, description, requesterId, requesterName, details,
                    clock.instant(), nextSequence++);
            requests.put(request.id(), request);
            log.info("Filed {} request {} from {}", kind, request.id(), request.requesterName());
            return request;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record a decision on a pending request.
     *
     * @return the decided request, or empty if the id is unknown or the request was already decided
     */
    public Optional<ApprovalRequest> decide(UUID id, Decision decision, String note) {
        lock.writeLock().lock();
        try {
            ApprovalRequest current = requests.get(id);
            if (current == null) {
                log.debug("Decision {} for unknown request {}", decision, id);
                return Optional.empty();
            }
            if (current.status().isTerminal()) {
                log.warn("Request {} already {}; ignoring {}", id, current.status(), decision);
                return Optional.empty();
            }
            var decided = current.decided(decision, note, clock.instant());
            requests.put(id, decided);
            log.info("Request {} {}", id, decided.status());
            return Optional.of(decided);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ApprovalRequest> get(UUID id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(requests.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Pending requests, oldest first. */
    public List<ApprovalRequest> pending() {
        lock.readLock().lock();
        try {
            return requests.values().stream()
                    .filter(ApprovalRequest::isPending)
                    .sorted(FILING_ORDER)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int pendingCount() {
        lock.readLock().lock();
        try {
            return (int) requests.values().stream().filter(ApprovalRequest::isPending).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** All requests in filing order. */
    public List<ApprovalRequest> all() {
        lock.readLock().lock();
        try {
            return requests.values().stream().sorted(FILING_ORDER).toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Find the request a chat reference points at.
     * <p>
     * A blank reference selects the oldest pending request. Otherwise the full id wins, then ids
     * starting with the reference, then ids containing it (case-insensitive); among several
     * candidates of the same class the earliest filed request wins.
     */
    public Optional<ApprovalRequest> resolveRef(String ref) {
        if (ref == null || ref.isBlank()) {
            return pending().stream().findFirst();
        }
        String needle = ref.strip().toLowerCase(Locale.ROOT);
        List<ApprovalRequest> ordered = all();

        for (ApprovalRequest request : ordered) {
            if (request.id().toString().equals(needle)) {
                return Optional.of(request);
            }
        }
        for (ApprovalRequest request : ordered) {
            if (request.id().toString().startsWith(needle)) {
                return Optional.of(request);
            }
        }
        for (ApprovalRequest request : ordered) {
            if (request.id().toString().contains(needle)) {
                return Optional.of(request);
            }
        }
        return Optional.empty();
    }

    /**
     * Replace the ledger contents, e.g. from a snapshot. Sequence numbering continues after
     * the highest restored sequence.
     */
    public void restore(Collection<ApprovalRequest> restored) {
        lock.writeLock().lock();
        try {
            requests.clear();
            long maxSequence = -1;
            var ordered = new ArrayList<>(restored);
            ordered.sort(FILING_ORDER);
            for (ApprovalRequest request : ordered) {
                requests.put(request.id(), request);
                maxSequence = Math.max(maxSequence, request.sequence());
            }
            nextSequence = maxSequence + 1;
            log.info("Restored {} approval requests", requests.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return requests.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
