package com.crmdesk.convsync.sync.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Timer-driven puller that re-feeds rows newer than the watermark as inserts.
 *
 * Ticks and row delivery run on the event loop; the fetch itself runs on {@code fetchExecutor}. At most one fetch is
 * outstanding: a tick that finds one in flight is skipped. Results arriving after {@link #stop()} are discarded.
 * Until one fetch has succeeded every tick asks for the latest page, whatever the watermark says.
 */
public class PollingFallback {

    private static final Logger log = LoggerFactory.getLogger(PollingFallback.class);

    private final ScheduledExecutorService timer;
    private final Executor loop;
    private final Executor fetchExecutor;
    private final Duration interval;

    private String conversationId;
    private Supplier<Optional<Instant>> latestTimestamp;
    private MessageFetcher fetcher;
    private Consumer<JsonNode> onRow;

    private ScheduledFuture<?> ticker;
    // bumped by start/stop so late fetch results can tell they are stale
    private volatile long generation;
    private volatile boolean running;
    private volatile boolean inFlight;
    private volatile boolean historyLoaded;

    public PollingFallback(ScheduledExecutorService timer, Executor loop, Executor fetchExecutor, Duration interval) {
        this.timer = timer;
        this.loop = loop;
        this.fetchExecutor = fetchExecutor;
        this.interval = interval;
    }

    public synchronized void start(
            String conversationId,
            Supplier<Optional<Instant>> latestTimestamp,
            MessageFetcher fetcher,
            Consumer<JsonNode> onRow
    ) {
        if (running) {
            throw new IllegalStateException("polling_already_started conversationId=" + this.conversationId);
        }
        this.conversationId = conversationId;
        this.latestTimestamp = latestTimestamp;
        this.fetcher = fetcher;
        this.onRow = onRow;
        this.generation++;
        this.inFlight = false;
        this.historyLoaded = false;
        this.running = true;

        // the first tick doubles as the initial history load
        this.ticker = timer.scheduleWithFixedDelay(
                this::dispatchTick,
                0,
                interval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        log.info("polling_started conversationId={} intervalMs={}", conversationId, interval.toMillis());
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        generation++;
        inFlight = false;
        if (ticker != null) {
            ticker.cancel(false);
            ticker = null;
        }
        log.info("polling_stopped conversationId={}", conversationId);
    }

    public boolean isRunning() {
        return running;
    }

    boolean isFetchInFlight() {
        return inFlight;
    }

    boolean isHistoryLoaded() {
        return historyLoaded;
    }

    private void dispatchTick() {
        try {
            loop.execute(this::tick);
        } catch (RejectedExecutionException e) {
            log.debug("polling_tick_dropped conversationId={} reason=loop_stopped", conversationId);
        }
    }

    /** One poll cycle; must run on the event loop. */
    void tick() {
        if (!running) return;
        if (inFlight) {
            log.debug("polling_tick_skipped conversationId={} reason=fetch_in_flight", conversationId);
            return;
        }

        Instant watermark;
        try {
            watermark = historyLoaded ? latestTimestamp.get().orElse(null) : null;
        } catch (Exception e) {
            log.warn("polling_watermark_failed conversationId={}", conversationId, e);
            return;
        }

        var forGeneration = generation;
        var convId = conversationId;
        var source = fetcher;
        inFlight = true;

        try {
            CompletableFuture
                    .supplyAsync(() -> source.fetchSince(convId, watermark), fetchExecutor)
                    .whenComplete((rows, err) -> deliver(forGeneration, watermark, rows, err));
        } catch (RejectedExecutionException e) {
            inFlight = false;
            log.warn("poll_fetch_rejected conversationId={} err={}", conversationId, e.toString());
        }
    }

    private void deliver(long forGeneration, Instant watermark, List<JsonNode> rows, Throwable err) {
        try {
            loop.execute(() -> {
                if (forGeneration != generation) {
                    log.debug("polling_result_discarded conversationId={} reason=stopped", conversationId);
                    return;
                }
                inFlight = false;
                if (err != null) {
                    log.warn("poll_fetch_failed conversationId={} watermark={} err={}", conversationId, watermark, causeOf(err).toString());
                    return;
                }
                historyLoaded = true;
                if (rows == null || rows.isEmpty()) return;
                log.debug("poll_fetched conversationId={} watermark={} rows={}", conversationId, watermark, rows.size());
                for (var row : rows) {
                    onRow.accept(row);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("polling_result_discarded conversationId={} reason=loop_stopped", conversationId);
        }
    }

    private static Throwable causeOf(Throwable err) {
        var t = err;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
