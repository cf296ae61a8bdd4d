package com.crmdesk.convsync.sync.ws;

import com.crmdesk.convsync.sync.model.ChangeEvent;
import com.crmdesk.convsync.sync.model.StreamState;
import com.crmdesk.convsync.sync.service.MessageRowMapper;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Push ingestion channel for one conversation.
 *
 * <pre>
 * INIT -> SUBSCRIBING -> SUBSCRIBED
 * SUBSCRIBING | SUBSCRIBED -> ERROR      (transport failure)
 * ERROR -> SUBSCRIBING                   (restart(), caller driven only)
 * any -> CLOSED                          (close(), terminal)
 * </pre>
 *
 * The client never retries on its own; the polling fallback covers the gap while it sits in ERROR or SUBSCRIBING.
 * Row callbacks run on the supplied event loop and are suppressed once CLOSED.
 */
public class ChangeStreamClient {

    private static final Logger log = LoggerFactory.getLogger(ChangeStreamClient.class);

    private static final AtomicLong HANDLE_SEQ = new AtomicLong();

    public record Handle(String conversationId, long id) {
    }

    private final ChangeFeed feed;
    private final String table;
    private final Executor loop;

    private volatile StreamState state = StreamState.INIT;
    private Handle handle;
    private ChangeFeed.Subscription subscription;
    private long attempt;

    private Consumer<JsonNode> onInsert;
    private Consumer<JsonNode> onUpdate;
    private Consumer<String> onDelete;

    public ChangeStreamClient(ChangeFeed feed, String table, Executor loop) {
        this.feed = feed;
        this.table = table;
        this.loop = loop;
    }

    public synchronized Handle open(
            String conversationId,
            Consumer<JsonNode> onInsert,
            Consumer<JsonNode> onUpdate,
            Consumer<String> onDelete
    ) {
        if (state != StreamState.INIT) {
            throw new IllegalStateException("change_stream_already_opened state=" + state);
        }
        this.onInsert = onInsert;
        this.onUpdate = onUpdate;
        this.onDelete = onDelete;
        this.handle = new Handle(conversationId, HANDLE_SEQ.incrementAndGet());
        subscribe();
        return handle;
    }

    /** Re-subscribes after a transport failure. Returns false unless the client was in ERROR. */
    public synchronized boolean restart() {
        if (state != StreamState.ERROR) {
            log.debug("change_stream_restart_ignored conversationId={} state={}", conversationIdOrNull(), state);
            return false;
        }
        cancelSubscription();
        subscribe();
        return true;
    }

    public synchronized void close(Handle handle) {
        if (handle == null || !handle.equals(this.handle)) {
            log.warn("change_stream_close_unknown_handle handle={}", handle);
            return;
        }
        if (state == StreamState.CLOSED) return;
        state = StreamState.CLOSED;
        cancelSubscription();
        log.info("change_stream_closed conversationId={}", handle.conversationId());
    }

    public StreamState state() {
        return state;
    }

    private void subscribe() {
        var current = ++attempt;
        state = StreamState.SUBSCRIBING;
        log.info("change_stream_subscribing conversationId={} table={} attempt={}", handle.conversationId(), table, current);
        try {
            subscription = feed.subscribe(table, handle.conversationId(), new AttemptListener(current));
        } catch (Exception e) {
            subscription = null;
            markError(current, e);
        }
    }

    private void cancelSubscription() {
        var s = subscription;
        subscription = null;
        if (s == null) return;
        try {
            s.cancel();
        } catch (Exception e) {
            log.warn("change_stream_cancel_failed conversationId={}", conversationIdOrNull(), e);
        }
    }

    private synchronized void markSubscribed(long forAttempt) {
        if (forAttempt != attempt || state != StreamState.SUBSCRIBING) return;
        state = StreamState.SUBSCRIBED;
        log.info("change_stream_subscribed conversationId={}", handle.conversationId());
    }

    private synchronized void markError(long forAttempt, Throwable error) {
        if (forAttempt != attempt) return;
        if (state != StreamState.SUBSCRIBING && state != StreamState.SUBSCRIBED) return;
        state = StreamState.ERROR;
        log.warn("change_stream_transport_error conversationId={} err={}", handle.conversationId(), String.valueOf(error));
    }

    private synchronized boolean isLive(long forAttempt) {
        return forAttempt == attempt && state != StreamState.CLOSED;
    }

    private void deliver(long forAttempt, ChangeEvent event) {
        if (event == null || event.kind() == null) return;
        if (!isLive(forAttempt)) return;
        try {
            loop.execute(() -> {
                if (!isLive(forAttempt)) return;
                dispatch(event);
            });
        } catch (RejectedExecutionException e) {
            log.debug("change_stream_event_dropped conversationId={} reason=loop_stopped", conversationIdOrNull());
        }
    }

    private void dispatch(ChangeEvent event) {
        switch (event.kind()) {
            case INSERT -> {
                if (event.newRow() != null) onInsert.accept(event.newRow());
            }
            case UPDATE -> {
                if (event.newRow() != null) onUpdate.accept(event.newRow());
            }
            case DELETE -> {
                var id = MessageRowMapper.idOf(event.oldRow());
                if (id == null) {
                    log.warn("change_stream_delete_without_id conversationId={}", conversationIdOrNull());
                    return;
                }
                onDelete.accept(id);
            }
        }
    }

    private String conversationIdOrNull() {
        return handle == null ? null : handle.conversationId();
    }

    private final class AttemptListener implements ChangeFeed.Listener {
        private final long forAttempt;

        private AttemptListener(long forAttempt) {
            this.forAttempt = forAttempt;
        }

        @Override
        public void onSubscribed() {
            markSubscribed(forAttempt);
        }

        @Override
        public void onChange(ChangeEvent event) {
            deliver(forAttempt, event);
        }

        @Override
        public void onError(Throwable error) {
            markError(forAttempt, error);
        }
    }
}
