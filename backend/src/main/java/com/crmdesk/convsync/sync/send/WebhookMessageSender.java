package com.crmdesk.convsync.sync.send;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Fire-and-forget POST of outbound messages to the configured webhook.
 *
 * Failures are logged and dropped: no retry, nothing reported to the sender.
 */
@Component
public class WebhookMessageSender {

    private static final Logger log = LoggerFactory.getLogger(WebhookMessageSender.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String webhookUrl;
    private final Duration timeout;

    public WebhookMessageSender(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            @Value("${app.sync.outbound.webhook-url:}") String webhookUrl,
            @Value("${app.sync.outbound.timeout-ms:10000}") long timeoutMs
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.webhookUrl = webhookUrl == null ? "" : webhookUrl.trim();
        this.timeout = Duration.ofMillis(Math.max(500, timeoutMs));
    }

    /**
     * Completes once the attempt is over, successful or not. The future never completes exceptionally.
     */
    public CompletableFuture<Void> send(OutboundMessage message) {
        if (message == null) return CompletableFuture.completedFuture(null);

        if (webhookUrl.isEmpty()) {
            // Dev/test default: log-only delivery.
            log.info("outbound_send (disabled) conversationId={} messageId={}", message.conversation_id(), message.message_id());
            return CompletableFuture.completedFuture(null);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(webhookUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(message)))
                    .build();
        } catch (Exception e) {
            log.warn("outbound_send_failed conversationId={} messageId={} err={}",
                    message.conversation_id(), message.message_id(), e.toString());
            return CompletableFuture.completedFuture(null);
        }

        try {
            return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                    .handle((response, err) -> {
                        if (err != null) {
                            log.warn("outbound_send_failed conversationId={} messageId={} err={}",
                                    message.conversation_id(), message.message_id(), err.toString());
                        } else if (response.statusCode() / 100 != 2) {
                            log.warn("outbound_send_rejected conversationId={} messageId={} status={}",
                                    message.conversation_id(), message.message_id(), response.statusCode());
                        } else {
                            log.info("outbound_send_ok conversationId={} messageId={}", message.conversation_id(), message.message_id());
                        }
                        return null;
                    });
        } catch (Exception e) {
            log.warn("outbound_send_failed conversationId={} messageId={} err={}",
                    message.conversation_id(), message.message_id(), e.toString());
            return CompletableFuture.completedFuture(null);
        }
    }
}
