package com.arenabox.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a bulk operation where every item is attempted independently.
 *
 * @param succeeded items processed successfully
 * @param failed    items that failed
 * @param errors    one reason per failed item
 */
public record BulkResult(
        @JsonProperty("deleted") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("errors") List<String> errors
) {

    public BulkResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    @JsonProperty("success")
    public boolean success() {
        return failed == 0;
    }
}
