package com.crmdesk.convsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One row-level change pushed by the feed. {@code newRow} is set for inserts and updates, {@code oldRow} for deletes.
 */
public record ChangeEvent(ChangeKind kind, JsonNode newRow, JsonNode oldRow) {
}
