package com.crmdesk.convsync.sync.ws;

import com.crmdesk.convsync.sync.model.ChangeEvent;

/**
 * Capability to subscribe to row-level change notifications of one table, filtered by conversation.
 */
public interface ChangeFeed {

    Subscription subscribe(String table, String conversationId, Listener listener);

    /**
     * Callbacks may arrive on any thread, in any order relative to row timestamps.
     */
    interface Listener {
        void onSubscribed();

        void onChange(ChangeEvent event);

        void onError(Throwable error);
    }

    interface Subscription {
        void cancel();
    }
}
