package com.crmdesk.convsync.sync.ws;

import com.crmdesk.convsync.sync.model.ChangeEvent;
import com.crmdesk.convsync.sync.model.ChangeKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * In-memory feed; tests drive the listener of the latest subscription by hand.
 */
public class FakeChangeFeed implements ChangeFeed {

    public final List<Listener> listeners = new ArrayList<>();
    public final List<String> subscribedConversations = new ArrayList<>();
    public int cancelled;
    public RuntimeException failOnSubscribe;

    @Override
    public Subscription subscribe(String table, String conversationId, Listener listener) {
        if (failOnSubscribe != null) {
            throw failOnSubscribe;
        }
        listeners.add(listener);
        subscribedConversations.add(conversationId);
        return () -> cancelled++;
    }

    public Listener latest() {
        return listeners.get(listeners.size() - 1);
    }

    public void ack() {
        latest().onSubscribed();
    }

    public void fail(String reason) {
        latest().onError(new IllegalStateException(reason));
    }

    public void insert(JsonNode row) {
        latest().onChange(new ChangeEvent(ChangeKind.INSERT, row, null));
    }

    public void update(JsonNode row) {
        latest().onChange(new ChangeEvent(ChangeKind.UPDATE, row, null));
    }

    public void delete(JsonNode oldRow) {
        latest().onChange(new ChangeEvent(ChangeKind.DELETE, null, oldRow));
    }
}
