package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.Message;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static com.crmdesk.convsync.sync.service.Rows.CONV;
import static com.crmdesk.convsync.sync.service.Rows.idOnly;
import static com.crmdesk.convsync.sync.service.Rows.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private MessageStore store;
    private EventReconciler reconciler;

    @BeforeEach
    void setUp() {
        store = new MessageStore();
        var directory = SenderDirectory.of(Map.of("+4915112345", "Alice"));
        reconciler = new EventReconciler(CONV, store, directory, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void insert_is_idempotent() {
        reconciler.applyInsert(row("1", 100));
        var once = store.all();

        reconciler.applyInsert(row("1", 100));

        assertEquals(once, store.all());
        assertEquals(1, store.size());
    }

    @Test
    void duplicate_insert_does_not_overwrite_later_update() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyUpdate(idOnly("1").put("text", "edited"));

        // the poll channel re-delivers the original row
        reconciler.applyInsert(row("1", 100));

        assertEquals("edited", store.lookup("1").orElseThrow().text());
    }

    @Test
    void inserts_and_update_end_up_newest_first() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyInsert(row("2", 50));
        reconciler.applyUpdate(idOnly("1").put("text", "edited"));

        var all = store.all();
        assertEquals(List.of("1", "2"), ids(all));
        assertEquals("edited", all.get(0).text());
        assertEquals(Instant.ofEpochMilli(100), all.get(0).orderingKey());
        assertEquals(Instant.ofEpochMilli(50), all.get(1).orderingKey());
    }

    @Test
    void update_with_only_text_preserves_metadata_and_reply_to() {
        ObjectNode original = row("5", 100);
        original.put("reply_to", "7");
        original.putObject("metadata").put("channel", "whatsapp");
        reconciler.applyInsert(original);

        reconciler.applyUpdate(idOnly("5").put("text", "changed"));

        var m = store.lookup("5").orElseThrow();
        assertEquals("changed", m.text());
        assertEquals("7", m.replyTo());
        assertEquals("whatsapp", m.metadata().path("channel").asText());
        assertEquals(Instant.ofEpochMilli(100), m.createdAt());
    }

    @Test
    void update_ignores_explicit_nulls() {
        ObjectNode original = row("5", 100);
        original.put("sender_id", "+4915112345");
        reconciler.applyInsert(original);

        reconciler.applyUpdate(idOnly("5").putNull("sender_id").putNull("text"));

        var m = store.lookup("5").orElseThrow();
        assertEquals("+4915112345", m.senderId());
        assertEquals("msg 5", m.text());
        assertFalse(m.fromMe());
    }

    @Test
    void update_for_unknown_id_creates_the_message() {
        reconciler.applyUpdate(row("9", 100).put("text", "arrived via update"));

        assertEquals(1, store.size());
        assertEquals("arrived via update", store.lookup("9").orElseThrow().text());
    }

    @Test
    void update_of_platform_timestamp_reorders() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyInsert(row("2", 200));
        assertEquals(List.of("2", "1"), ids(store.all()));

        reconciler.applyUpdate(idOnly("1").put("platform_timestamp", Instant.ofEpochMilli(300).toString()));

        assertEquals(List.of("1", "2"), ids(store.all()));
    }

    @Test
    void delete_then_insert_recreates() {
        reconciler.applyInsert(row("42", 100).put("text", "old"));
        reconciler.applyDelete("42");
        assertFalse(store.contains("42"));

        reconciler.applyInsert(row("42", 120).put("text", "new"));

        var m = store.lookup("42").orElseThrow();
        assertEquals("new", m.text());
        assertEquals(Instant.ofEpochMilli(120), m.createdAt());
    }

    @Test
    void delete_is_idempotent() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyDelete("1");
        reconciler.applyDelete("1");
        reconciler.applyDelete("never-seen");
        reconciler.applyDelete(null);

        assertEquals(0, store.size());
    }

    @Test
    void reply_is_linked_once_target_arrives() {
        reconciler.applyInsert(row("8", 200).put("reply_to", "7"));
        assertNull(store.lookup("8").orElseThrow().replyToMessage());

        reconciler.applyInsert(row("7", 100));

        var link = store.lookup("8").orElseThrow().replyToMessage();
        assertNotNull(link);
        assertEquals("7", link.id());
    }

    @Test
    void reply_link_follows_target_update_and_delete() {
        reconciler.applyInsert(row("7", 100));
        reconciler.applyInsert(row("8", 200).put("reply_to", "7"));

        reconciler.applyUpdate(idOnly("7").put("text", "target edited"));
        assertEquals("target edited", store.lookup("8").orElseThrow().replyToMessage().text());

        reconciler.applyDelete("7");
        var reply = store.lookup("8").orElseThrow();
        assertEquals("7", reply.replyTo());
        assertNull(reply.replyToMessage());
    }

    @Test
    void linked_target_carries_no_nested_link() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyInsert(row("2", 200).put("reply_to", "1"));
        reconciler.applyInsert(row("3", 300).put("reply_to", "2"));

        var link = store.lookup("3").orElseThrow().replyToMessage();
        assertEquals("2", link.id());
        assertNull(link.replyToMessage());
        assertEquals("1", store.lookup("2").orElseThrow().replyToMessage().id());
    }

    @Test
    void derived_sender_fields() {
        reconciler.applyInsert(row("1", 100));
        reconciler.applyInsert(row("2", 110).put("sender_id", "+4915112345"));
        reconciler.applyInsert(row("3", 120).put("sender_id", "+10000000"));

        var mine = store.lookup("1").orElseThrow();
        assertTrue(mine.fromMe());
        assertEquals("Unknown", mine.senderDisplayName());

        var known = store.lookup("2").orElseThrow();
        assertFalse(known.fromMe());
        assertEquals("Alice", known.senderDisplayName());

        var stranger = store.lookup("3").orElseThrow();
        assertFalse(stranger.fromMe());
        assertEquals("+10000000", stranger.senderDisplayName());
    }

    @Test
    void missing_created_at_falls_back_to_receipt_time() {
        reconciler.applyInsert(idOnly("1").put("text", "no timestamp"));

        assertEquals(NOW, store.lookup("1").orElseThrow().createdAt());
        assertTrue(store.lookup("1").orElseThrow().createdAtLocal());
    }

    @Test
    void receipt_time_does_not_advance_the_watermark() {
        reconciler.applyInsert(row("h1", 1_000));
        reconciler.applyUpdate(idOnly("u9").put("text", "update before insert"));

        assertEquals(2, store.size());
        assertEquals(Instant.ofEpochMilli(1_000), store.latestCreatedAt().orElseThrow());

        // the late insert supplies the server timestamp but not its older text
        reconciler.applyInsert(row("u9", 2_000));

        var u9 = store.lookup("u9").orElseThrow();
        assertFalse(u9.createdAtLocal());
        assertEquals(Instant.ofEpochMilli(2_000), u9.createdAt());
        assertEquals("update before insert", u9.text());
        assertEquals(Instant.ofEpochMilli(2_000), store.latestCreatedAt().orElseThrow());
    }

    @Test
    void rows_without_id_or_from_another_conversation_are_dropped() {
        reconciler.applyInsert(Rows.MAPPER.createObjectNode().put("text", "no id"));
        reconciler.applyInsert(null);
        reconciler.applyInsert(row("1", 100).put("conversation_id", "other"));

        assertEquals(0, store.size());
    }

    @Test
    void order_invariant_holds_for_random_event_sequences() {
        var random = new Random(42);
        for (int i = 0; i < 500; i++) {
            var id = String.valueOf(random.nextInt(30));
            switch (random.nextInt(4)) {
                case 0, 1 -> reconciler.applyInsert(row(id, random.nextInt(1000)));
                case 2 -> {
                    ObjectNode patch = idOnly(id);
                    if (random.nextBoolean()) {
                        patch.put("platform_timestamp", Instant.ofEpochMilli(random.nextInt(1000)).toString());
                    }
                    patch.put("text", "edit " + i);
                    reconciler.applyUpdate(patch);
                }
                default -> reconciler.applyDelete(id);
            }
            assertSortedNewestFirst(store.all());
        }
    }

    private static void assertSortedNewestFirst(List<Message> all) {
        for (int i = 1; i < all.size(); i++) {
            var prev = all.get(i - 1).orderingKey();
            var cur = all.get(i).orderingKey();
            assertFalse(prev.isBefore(cur), "out of order at " + i + ": " + prev + " < " + cur);
        }
        assertEquals(all.size(), all.stream().map(Message::id).distinct().count());
    }

    private static List<String> ids(List<Message> all) {
        return all.stream().map(Message::id).toList();
    }
}
