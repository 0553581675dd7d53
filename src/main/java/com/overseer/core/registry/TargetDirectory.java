package com.overseer.core.registry;

import java.util.Optional;

/**
 * External lookup consulted when a name is not in the {@link TargetRegistry},
 * e.g. the departments of the surrounding organisation.
 */
@FunctionalInterface
public interface TargetDirectory {

    /**
     * @param name the name as typed by the Overseer
     * @return the id of the matching unit, if any
     */
    Optional<String> findIdByName(String name);
}
