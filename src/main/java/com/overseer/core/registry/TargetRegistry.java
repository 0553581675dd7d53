package com.overseer.core.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Name to target directory with case-insensitive exact and substring lookup.
 * <p>
 * Names are stored lower-cased. Iteration is in ascending name order, so when several
 * names match a fuzzy lookup the lexicographically smallest one wins.
 * Thread-safe for concurrent registration and lookup.
 */
public class TargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(TargetRegistry.class);

    private final ConcurrentSkipListMap<String, Target> targets = new ConcurrentSkipListMap<>();

    /**
     * Register a target under a name. Re-registering a name replaces the previous target.
     * {@link Supervisable} targets are linked to the given channel.
     *
     * @param name    the name the Overseer will address the target by
     * @param target  the target
     * @param channel the Overseer the target reports to
     */
    public void register(String name, Target target, OverseerChannel channel) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(target, "target");
        String key = normalise(name);
        Target previous = targets.put(key, target);
        if (previous != null && previous != target) {
            log.info("Replaced target '{}' ({} -> {})", key, previous.id(), target.id());
        } else {
            log.info("Registered target '{}' ({})", key, target.id());
        }

        if (channel != null && target instanceof Supervisable supervisable) {
            if (!supervisable.reportsTo().contains(channel.overseerId())) {
                supervisable.addReportsTo(channel.overseerId());
            }
            supervisable.attachOverseer(channel);
        }
    }

    /**
     * @return true if the name was registered and has been removed
     */
    public boolean unregister(String name) {
        if (name == null) {
            return false;
        }
        boolean removed = targets.remove(normalise(name)) != null;
        if (removed) {
            log.info("Unregistered target '{}'", normalise(name));
        }
        return removed;
    }

    /**
     * Resolve a name to a target id: exact (case-insensitive) match first, then the first
     * registered name that contains the query or is contained in it.
     */
    public Optional<String> resolve(String name) {
        return resolveTarget(name).map(Target::id);
    }

    public Optional<Target> resolveTarget(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String query = normalise(name);
        Target exact = targets.get(query);
        if (exact != null) {
            return Optional.of(exact);
        }
        for (Map.Entry<String, Target> entry : targets.entrySet()) {
            String key = entry.getKey();
            if (key.contains(query) || query.contains(key)) {
                log.debug("Fuzzy-matched '{}' to target '{}'", query, key);
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    public Optional<Target> byId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        for (Target target : targets.values()) {
            if (id.equals(target.id())) {
                return Optional.of(target);
            }
        }
        return Optional.empty();
    }

    /** Registered names in ascending order. */
    public List<String> names() {
        return new ArrayList<>(targets.keySet());
    }

    public int size() {
        return targets.size();
    }

    private static String normalise(String name) {
        return name.strip().toLowerCase(Locale.ROOT);
    }
}
