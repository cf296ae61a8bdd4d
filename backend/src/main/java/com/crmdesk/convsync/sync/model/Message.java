package com.crmdesk.convsync.sync.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * A message as held by the sync engine.
 *
 * {@code fromMe}, {@code senderDisplayName} and {@code replyToMessage} are derived by the engine and never
 * read from upstream rows. {@code createdAtLocal} marks a {@code createdAt} taken from the local receipt time because
 * the row carried none; such values never feed the polling watermark.
 */
public record Message(
        String id,
        String conversationId,
        String text,
        String content,
        String senderId,
        JsonNode metadata,
        String replyTo,
        Instant createdAt,
        Instant platformTimestamp,
        boolean createdAtLocal,
        boolean fromMe,
        String senderDisplayName,
        Message replyToMessage
) {

    public Instant orderingKey() {
        return platformTimestamp != null ? platformTimestamp : createdAt;
    }

    /** Text to show: {@code text} when non-blank, else {@code content}. */
    public String body() {
        if (text != null && !text.isBlank()) return text;
        return content;
    }

    public Message withReplyToMessage(Message target) {
        return new Message(
                id,
                conversationId,
                text,
                content,
                senderId,
                metadata,
                replyTo,
                createdAt,
                platformTimestamp,
                createdAtLocal,
                fromMe,
                senderDisplayName,
                target
        );
    }
}
