package com.arenabox.core.model;

/**
 * Owning identity type of a sandbox. Deployments run in either user mode or team mode.
 */
public enum ParticipantKind {
    USER,
    TEAM;

    public static ParticipantKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Participant kind is required");
        }
        return ParticipantKind.valueOf(value.trim().toUpperCase());
    }
}
