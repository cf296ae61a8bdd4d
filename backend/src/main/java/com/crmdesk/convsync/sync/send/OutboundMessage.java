package com.crmdesk.convsync.sync.send;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of the outbound webhook. Field names are the wire names.
 */
public record OutboundMessage(
        String text,
        String conversation_id,
        String reply_to,
        String timestamp,
        String message_id,
        String sender,
        JsonNode metadata
) {
}
