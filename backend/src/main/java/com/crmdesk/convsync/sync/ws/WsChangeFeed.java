package com.crmdesk.convsync.sync.ws;

import com.crmdesk.convsync.sync.model.ChangeEvent;
import com.crmdesk.convsync.sync.model.ChangeKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * {@link ChangeFeed} over a WebSocket change relay.
 *
 * Protocol: after connecting the client sends {@code {"type":"SUBSCRIBE","table":..,"conversation_id":..}}; the relay
 * acks with {@code {"type":"SUBSCRIBED"}} and then pushes {@code {"type":"INSERT|UPDATE|DELETE","new":{..},"old":{..}}}
 * frames ({@code eventType} is accepted in place of {@code type}). {@code {"type":"ERROR"}} frames, transport errors
 * and closes not requested by us are reported as transport failures.
 */
@Component
public class WsChangeFeed implements ChangeFeed {

    private static final Logger log = LoggerFactory.getLogger(WsChangeFeed.class);

    private final ObjectMapper objectMapper;
    private final WebSocketClient webSocketClient;
    private final String url;

    public WsChangeFeed(
            ObjectMapper objectMapper,
            WebSocketClient webSocketClient,
            @Value("${app.sync.change-feed.url:}") String url
    ) {
        this.objectMapper = objectMapper;
        this.webSocketClient = webSocketClient;
        this.url = url == null ? "" : url.trim();
    }

    @Override
    public Subscription subscribe(String table, String conversationId, Listener listener) {
        var handler = new FrameHandler(objectMapper, table, conversationId, listener);
        if (url.isEmpty()) {
            listener.onError(new IllegalStateException("change_feed_not_configured"));
            return handler::cancel;
        }

        URI uri = UriComponentsBuilder.fromUriString(url)
                .queryParam("conversation_id", conversationId)
                .queryParam("table", table)
                .build()
                .toUri();

        webSocketClient.execute(handler, new WebSocketHttpHeaders(), uri).whenComplete((session, err) -> {
            if (err != null) {
                listener.onError(err);
            }
        });
        return handler::cancel;
    }

    static final class FrameHandler extends TextWebSocketHandler {

        private final ObjectMapper objectMapper;
        private final String table;
        private final String conversationId;
        private final Listener listener;

        private volatile WebSocketSession session;
        private volatile boolean cancelled;

        FrameHandler(ObjectMapper objectMapper, String table, String conversationId, Listener listener) {
            this.objectMapper = objectMapper;
            this.table = table;
            this.conversationId = conversationId;
            this.listener = listener;
        }

        void cancel() {
            cancelled = true;
            var s = session;
            if (s != null) {
                closeQuietly(s);
            }
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) throws IOException {
            this.session = session;
            if (cancelled) {
                closeQuietly(session);
                return;
            }
            ObjectNode subscribe = objectMapper.createObjectNode();
            subscribe.put("type", "SUBSCRIBE");
            subscribe.put("table", table);
            subscribe.put("conversation_id", conversationId);
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(subscribe)));
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            if (cancelled) return;

            JsonNode frame;
            try {
                frame = objectMapper.readTree(message.getPayload());
            } catch (Exception e) {
                log.warn("change_feed_bad_frame conversationId={} err={}", conversationId, e.toString());
                return;
            }
            if (frame == null || !frame.isObject()) return;

            var type = frame.path("type").asText("");
            if (type.isBlank()) {
                type = frame.path("eventType").asText("");
            }

            if ("SUBSCRIBED".equalsIgnoreCase(type)) {
                listener.onSubscribed();
                return;
            }
            if ("ERROR".equalsIgnoreCase(type)) {
                var reason = frame.path("error").asText("unknown");
                listener.onError(new IllegalStateException("change_feed_error: " + reason));
                return;
            }

            var kind = ChangeKind.parse(type);
            if (kind == null) {
                log.debug("change_feed_frame_ignored conversationId={} type={}", conversationId, type);
                return;
            }
            listener.onChange(new ChangeEvent(kind, rowOrNull(frame, "new"), rowOrNull(frame, "old")));
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            if (cancelled) return;
            listener.onError(exception);
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            if (cancelled) return;
            listener.onError(new IllegalStateException("change_feed_closed status=" + status));
        }

        private static JsonNode rowOrNull(JsonNode frame, String field) {
            var node = frame.get(field);
            return (node != null && node.isObject() && node.size() > 0) ? node : null;
        }

        private void closeQuietly(WebSocketSession s) {
            try {
                if (s.isOpen()) {
                    s.close(CloseStatus.NORMAL);
                }
            } catch (IOException e) {
                log.debug("change_feed_close_failed conversationId={} err={}", conversationId, e.toString());
            }
        }
    }
}
