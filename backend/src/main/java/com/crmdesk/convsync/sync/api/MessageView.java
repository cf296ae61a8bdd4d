package com.crmdesk.convsync.sync.api;

import com.crmdesk.convsync.sync.model.Message;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

public record MessageView(
        String id,
        String conversation_id,
        String text,
        String content,
        String sender_id,
        String sender_display_name,
        @JsonProperty("is_from_me") boolean is_from_me,
        JsonNode metadata,
        String reply_to,
        ReplyPreview reply_to_message,
        String created_at,
        String platform_timestamp
) {

    public record ReplyPreview(String id, String text, String sender_display_name,
                               @JsonProperty("is_from_me") boolean is_from_me) {
    }

    public static MessageView of(Message m) {
        var target = m.replyToMessage();
        var preview = target == null
                ? null
                : new ReplyPreview(target.id(), target.body(), target.senderDisplayName(), target.fromMe());
        return new MessageView(
                m.id(),
                m.conversationId(),
                m.text(),
                m.content(),
                m.senderId(),
                m.senderDisplayName(),
                m.fromMe(),
                m.metadata(),
                m.replyTo(),
                preview,
                m.createdAt() == null ? null : m.createdAt().toString(),
                m.platformTimestamp() == null ? null : m.platformTimestamp().toString()
        );
    }
}
