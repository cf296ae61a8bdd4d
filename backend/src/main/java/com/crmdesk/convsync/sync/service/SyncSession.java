package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.Message;
import com.crmdesk.convsync.sync.model.StreamState;
import com.crmdesk.convsync.sync.ws.ChangeFeed;
import com.crmdesk.convsync.sync.ws.ChangeStreamClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Keeps one conversation's message list in sync.
 *
 * Owns the event loop, the store and both ingestion channels. The change stream and the polling fallback are
 * always started and stopped together and always feed the same store.
 */
public class SyncSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncSession.class);

    public record Settings(String table, Duration pollInterval) {
    }

    private final String conversationId;
    private final ScheduledExecutorService loop;
    private final MessageStore store;
    private final EventReconciler reconciler;
    private final ChangeStreamClient changeStream;
    private final PollingFallback polling;
    private final MessageFetcher fetcher;
    private final Consumer<List<Message>> changeListener;

    private volatile List<Message> view = List.of();
    private volatile boolean opened;
    private volatile boolean closed;
    private ChangeStreamClient.Handle handle;

    public SyncSession(
            String conversationId,
            Settings settings,
            ScheduledExecutorService loop,
            Executor fetchExecutor,
            ChangeFeed changeFeed,
            MessageFetcher fetcher,
            SenderDirectory directory,
            Clock clock,
            Consumer<List<Message>> changeListener
    ) {
        this.conversationId = conversationId;
        this.loop = loop;
        this.store = new MessageStore();
        this.reconciler = new EventReconciler(conversationId, store, directory, clock);
        this.changeStream = new ChangeStreamClient(changeFeed, settings.table(), loop);
        this.polling = new PollingFallback(loop, loop, fetchExecutor, settings.pollInterval());
        this.fetcher = fetcher;
        this.changeListener = changeListener;
    }

    public synchronized void open() {
        if (closed) throw new IllegalStateException("sync_session_closed conversationId=" + conversationId);
        if (opened) return;
        opened = true;

        handle = changeStream.open(
                conversationId,
                row -> onLoop(() -> reconciler.applyInsert(row)),
                row -> onLoop(() -> reconciler.applyUpdate(row)),
                id -> onLoop(() -> reconciler.applyDelete(id))
        );
        polling.start(
                conversationId,
                store::latestCreatedAt,
                fetcher,
                (JsonNode row) -> onLoop(() -> reconciler.applyInsert(row))
        );
        log.info("sync_session_opened conversationId={}", conversationId);
    }

    /**
     * Stops both channels, drops queued work and discards the store. No callback reaches the store afterwards.
     */
    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;

        if (handle != null) {
            changeStream.close(handle);
        }
        polling.stop();
        view = List.of();

        try {
            loop.execute(store::clear);
        } catch (RejectedExecutionException ignored) {
            // loop already stopped; nothing left to clear from
        }
        loop.shutdown();
        log.info("sync_session_closed conversationId={}", conversationId);
    }

    /** Re-subscribes the change stream after a transport failure; false if it was not in ERROR. */
    public boolean restartChangeStream() {
        if (closed) return false;
        return changeStream.restart();
    }

    /** Latest ordered snapshot, newest first. Safe to call from any thread. */
    public List<Message> messages() {
        return view;
    }

    public StreamState streamState() {
        return changeStream.state();
    }

    public boolean isPolling() {
        return polling.isRunning();
    }

    public boolean isClosed() {
        return closed;
    }

    public String conversationId() {
        return conversationId;
    }

    // runs on the loop: channel callbacks are already marshalled there
    private void onLoop(Runnable mutation) {
        if (closed) return;
        mutation.run();
        publish();
    }

    private void publish() {
        if (closed) return;
        var next = store.all();
        view = next;
        // close() may have cleared the view between the check above and the write
        if (closed) {
            view = List.of();
            return;
        }
        if (changeListener == null) return;
        try {
            changeListener.accept(next);
        } catch (Exception e) {
            log.warn("sync_change_listener_failed conversationId={}", conversationId, e);
        }
    }
}
