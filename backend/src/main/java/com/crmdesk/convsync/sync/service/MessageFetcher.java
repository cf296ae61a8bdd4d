package com.crmdesk.convsync.sync.service;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * Pull capability backing the polling fallback.
 */
public interface MessageFetcher {

    /**
     * Rows of the conversation created strictly after {@code watermark}, ascending by {@code created_at}.
     * A null watermark asks for the most recent page, still returned ascending.
     */
    List<JsonNode> fetchSince(String conversationId, Instant watermark);
}
