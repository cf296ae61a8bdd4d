package com.crmdesk.convsync.sync.send;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Builds and dispatches outbound messages.
 *
 * The sent message is not inserted into any sync store. It shows up once it round-trips through the change
 * stream or the polling fallback.
 */
@Service
public class OutboundMessageService {

    private final WebhookMessageSender sender;
    private final Clock clock;
    private final String defaultSender;

    public OutboundMessageService(
            WebhookMessageSender sender,
            Clock clock,
            @Value("${app.sync.outbound.sender:agent}") String defaultSender
    ) {
        this.sender = sender;
        this.clock = clock;
        this.defaultSender = (defaultSender == null || defaultSender.isBlank()) ? "agent" : defaultSender.trim();
    }

    /** Returns the generated message id; delivery happens in the background. */
    public String send(String conversationId, String text, String replyTo, String senderName, JsonNode metadata) {
        if (conversationId == null || conversationId.isBlank()) throw new IllegalArgumentException("missing_conversation_id");
        if (text == null || text.isBlank()) throw new IllegalArgumentException("missing_text");

        var messageId = UUID.randomUUID().toString();
        var message = new OutboundMessage(
                text,
                conversationId,
                (replyTo == null || replyTo.isBlank()) ? null : replyTo,
                clock.instant().toString(),
                messageId,
                (senderName == null || senderName.isBlank()) ? defaultSender : senderName.trim(),
                metadata
        );
        sender.send(message);
        return messageId;
    }
}
