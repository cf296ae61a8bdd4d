package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.Message;
import com.crmdesk.convsync.sync.model.MessageRow;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;

/**
 * Applies raw insert/update/delete rows from either ingestion channel to a {@link MessageStore}.
 *
 * Every operation is idempotent under redelivery, so neither channel has to deduplicate on its own.
 * Callers must invoke it from the owning session's event loop.
 */
public class EventReconciler {

    private static final Logger log = LoggerFactory.getLogger(EventReconciler.class);

    static final String UNKNOWN_SENDER = "Unknown";

    private final String conversationId;
    private final MessageStore store;
    private final SenderDirectory directory;
    private final Clock clock;

    public EventReconciler(String conversationId, MessageStore store, SenderDirectory directory, Clock clock) {
        this.conversationId = conversationId;
        this.store = store;
        this.directory = directory == null ? SenderDirectory.empty() : directory;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public void applyInsert(JsonNode raw) {
        var row = coerce(raw, "insert");
        if (row == null) return;

        var existing = store.lookup(row.id()).orElse(null);
        if (existing != null) {
            if (existing.createdAtLocal() && row.createdAt() != null) {
                // only the upstream created_at is taken; later updates keep their fields
                store.upsert(adoptCreatedAt(existing, row.createdAt()));
                relinkReplies();
                return;
            }
            log.debug("sync_insert_duplicate conversationId={} id={}", conversationId, row.id());
            return;
        }
        create(row);
        relinkReplies();
    }

    public void applyUpdate(JsonNode raw) {
        var row = coerce(raw, "update");
        if (row == null) return;

        var existing = store.lookup(row.id()).orElse(null);
        if (existing == null) {
            // the update raced ahead of its insert on the other channel
            create(row);
        } else {
            store.upsert(merge(existing, row));
        }
        relinkReplies();
    }

    public void applyDelete(String id) {
        if (id == null || id.isBlank()) {
            log.warn("sync_delete_without_id conversationId={}", conversationId);
            return;
        }
        store.remove(id);
        relinkReplies();
    }

    private MessageRow coerce(JsonNode raw, String kind) {
        var row = MessageRowMapper.map(raw).orElse(null);
        if (row == null) {
            log.warn("sync_row_rejected conversationId={} kind={} reason=missing_id", conversationId, kind);
            return null;
        }
        if (row.conversationId() != null && conversationId != null && !conversationId.equals(row.conversationId())) {
            log.warn("sync_row_rejected conversationId={} kind={} id={} reason=foreign_conversation rowConversationId={}",
                    conversationId, kind, row.id(), row.conversationId());
            return null;
        }
        return row;
    }

    private void create(MessageRow row) {
        var local = row.createdAt() == null;
        var createdAt = local ? clock.instant() : row.createdAt();
        var message = derive(
                row.id(),
                row.text(),
                row.content(),
                row.senderId(),
                row.metadata(),
                row.replyTo(),
                createdAt,
                local,
                row.platformTimestamp()
        );
        store.upsert(ThreadResolver.resolve(message, store));
    }

    private Message merge(Message existing, MessageRow row) {
        var merged = derive(
                existing.id(),
                pick(row.text(), existing.text()),
                pick(row.content(), existing.content()),
                pick(row.senderId(), existing.senderId()),
                pick(row.metadata(), existing.metadata()),
                pick(row.replyTo(), existing.replyTo()),
                pick(row.createdAt(), existing.createdAt()),
                row.createdAt() == null && existing.createdAtLocal(),
                pick(row.platformTimestamp(), existing.platformTimestamp())
        );
        return ThreadResolver.resolve(merged, store);
    }

    private Message adoptCreatedAt(Message existing, Instant createdAt) {
        var adopted = derive(
                existing.id(),
                existing.text(),
                existing.content(),
                existing.senderId(),
                existing.metadata(),
                existing.replyTo(),
                createdAt,
                false,
                existing.platformTimestamp()
        );
        return ThreadResolver.resolve(adopted, store);
    }

    private Message derive(
            String id,
            String text,
            String content,
            String senderId,
            JsonNode metadata,
            String replyTo,
            Instant createdAt,
            boolean createdAtLocal,
            Instant platformTimestamp
    ) {
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
                senderId == null,
                displayNameOf(senderId),
                null
        );
    }

    String displayNameOf(String senderId) {
        if (senderId != null) {
            var name = directory.displayName(senderId).orElse(null);
            if (name != null && !name.isBlank()) return name;
            if (!senderId.isBlank()) return senderId;
        }
        return UNKNOWN_SENDER;
    }

    /** Re-resolves every reply so links follow updates and deletes of their targets. */
    private void relinkReplies() {
        for (var message : store.all()) {
            if (message.replyTo() == null && message.replyToMessage() == null) continue;
            var relinked = ThreadResolver.resolve(message, store);
            if (!relinked.equals(message)) {
                store.upsert(relinked);
            }
        }
    }

    private static <T> T pick(T incoming, T current) {
        return incoming != null ? incoming : current;
    }
}
