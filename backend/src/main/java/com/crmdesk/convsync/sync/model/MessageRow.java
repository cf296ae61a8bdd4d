package com.crmdesk.convsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A raw change row after coercion. Every field except {@code id} may be null, meaning "not carried by this row".
 */
public record MessageRow(
        String id,
        String conversationId,
        String text,
        String content,
        String senderId,
        JsonNode metadata,
        String replyTo,
        Instant createdAt,
        Instant platformTimestamp
) {
}
