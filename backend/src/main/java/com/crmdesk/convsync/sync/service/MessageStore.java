package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.Message;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Messages of one conversation keyed by id.
 *
 * Not thread-safe: a store is only touched from its session's event loop.
 */
public class MessageStore {

    // Newest first. List.sort is stable, so equal keys keep insertion order.
    private static final Comparator<Message> NEWEST_FIRST =
            Comparator.comparing(Message::orderingKey, Comparator.nullsLast(Comparator.reverseOrder()));

    // Iteration order is insertion order; replacing a value keeps its slot, remove + put moves it to the end.
    private final Map<String, Message> byId = new LinkedHashMap<>();

    public void upsert(Message message) {
        if (message == null || message.id() == null) return;
        byId.put(message.id(), message);
    }

    public void remove(String id) {
        if (id == null) return;
        byId.remove(id);
    }

    public Optional<Message> lookup(String id) {
        if (id == null) return Optional.empty();
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return id != null && byId.containsKey(id);
    }

    public int size() {
        return byId.size();
    }

    /** Ordered view, newest first. Recomputed on every call. */
    public List<Message> all() {
        var list = new ArrayList<>(byId.values());
        list.sort(NEWEST_FIRST);
        return List.copyOf(list);
    }

    /** Watermark for the polling fallback: the latest upstream {@code created_at} held, if any. */
    public Optional<Instant> latestCreatedAt() {
        Instant latest = null;
        for (var m : byId.values()) {
            if (m.createdAtLocal()) continue;
            var createdAt = m.createdAt();
            if (createdAt != null && (latest == null || createdAt.isAfter(latest))) {
                latest = createdAt;
            }
        }
        return Optional.ofNullable(latest);
    }

    public void clear() {
        byId.clear();
    }
}
