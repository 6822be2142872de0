package com.arenabox.core.model;

import java.util.Objects;

/**
 * A user or team that owns sandbox instances.
 *
 * @param kind user or team
 * @param id   identifier assigned by the host platform
 */
public record Participant(ParticipantKind kind, String id) {

    /** Longest id the instance tracker stores. */
    public static final int MAX_ID_LENGTH = 64;

    public Participant {
        Objects.requireNonNull(kind, "kind");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Participant id is required");
        }
    }

    public static Participant user(String id) {
        return new Participant(ParticipantKind.USER, id);
    }

    public static Participant team(String id) {
        return new Participant(ParticipantKind.TEAM, id);
    }

    /** Stable string form used for logging and sandbox naming, e.g. {@code team-5}. */
    public String key() {
        return kind.name().toLowerCase() + "-" + id;
    }
}
