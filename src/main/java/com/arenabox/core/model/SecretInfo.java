package com.arenabox.core.model;

/**
 * A secret as listed by the orchestrator. The value is never read back.
 */
public record SecretInfo(String id, String name) {}
