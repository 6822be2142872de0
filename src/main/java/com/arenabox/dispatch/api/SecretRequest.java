package com.arenabox.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/admin/secrets.
 */
public record SecretRequest(String name, String value) {

    @Override
    public String toString() {
        return "SecretRequest[name=" + name + "]";
    }
}
