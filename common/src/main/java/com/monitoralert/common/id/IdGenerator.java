package com.monitoralert.common.id;

/**
 * Source of fresh identifiers for monitors, triggers, actions and alerts.
 * Injected wherever a default id is assigned so tests can substitute a deterministic one.
 */
@FunctionalInterface
public interface IdGenerator {

    IdGenerator ULID = UlidGenerator::generate;

    String generate();
}
