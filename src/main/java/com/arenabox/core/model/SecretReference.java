package com.arenabox.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A multi-part challenge's pointer to an orchestrator secret.
 *
 * @param id           orchestrator-assigned secret id
 * @param protectedMode true to mount the secret owner-readable only
 */
public record SecretReference(
        @JsonProperty("id") String id,
        @JsonProperty("protected") boolean protectedMode
) {}
