package com.overseer.core.registry;

/**
 * A crew or agent the Overseer can address by name.
 * <p>
 * The engine never controls a target's lifecycle; it only holds a reference while registered.
 */
public interface Target {

    String id();

    default String name() {
        return id();
    }
}
