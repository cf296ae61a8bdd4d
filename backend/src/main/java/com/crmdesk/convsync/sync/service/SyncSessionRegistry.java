package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.repo.ConversationMemberRepository;
import com.crmdesk.convsync.sync.ws.ChangeFeed;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Open sync sessions, one per conversation.
 */
@Component
public class SyncSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SyncSessionRegistry.class);

    private final ChangeFeed changeFeed;
    private final MessageFetcher fetcher;
    private final ConversationMemberRepository memberRepository;
    private final ExecutorService fetchExecutor;
    private final Clock clock;
    private final SyncSession.Settings settings;

    private final Map<String, SyncSession> sessions = new ConcurrentHashMap<>();

    public SyncSessionRegistry(
            ChangeFeed changeFeed,
            MessageFetcher fetcher,
            ConversationMemberRepository memberRepository,
            @Qualifier("syncFetchExecutor") ExecutorService fetchExecutor,
            Clock clock,
            @Value("${app.sync.table:messages}") String table,
            @Value("${app.sync.poll-interval-ms:5000}") long pollIntervalMs
    ) {
        this.changeFeed = changeFeed;
        this.fetcher = fetcher;
        this.memberRepository = memberRepository;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        var safeTable = (table == null || table.isBlank()) ? "messages" : table.trim();
        this.settings = new SyncSession.Settings(safeTable, Duration.ofMillis(Math.max(100, pollIntervalMs)));
    }

    public SyncSession open(String conversationId) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("missing_conversation_id");
        }
        var current = sessions.get(conversationId);
        if (current != null && !current.isClosed()) return current;

        // built and opened outside the map so the directory query never runs under its lock
        var candidate = newSession(conversationId);
        candidate.open();
        var winner = sessions.compute(conversationId,
                (id, existing) -> (existing != null && !existing.isClosed()) ? existing : candidate);
        if (winner != candidate) {
            candidate.close();
        }
        return winner;
    }

    public Optional<SyncSession> find(String conversationId) {
        if (conversationId == null) return Optional.empty();
        return Optional.ofNullable(sessions.get(conversationId)).filter(s -> !s.isClosed());
    }

    public boolean close(String conversationId) {
        if (conversationId == null) return false;
        var session = sessions.remove(conversationId);
        if (session == null) return false;
        session.close();
        return true;
    }

    public int openCount() {
        return sessions.size();
    }

    @PreDestroy
    public void closeAll() {
        for (var id : new ArrayList<>(sessions.keySet())) {
            try {
                close(id);
            } catch (Exception e) {
                log.warn("sync_session_close_failed conversationId={}", id, e);
            }
        }
    }

    private SyncSession newSession(String conversationId) {
        SenderDirectory directory;
        try {
            directory = memberRepository.loadDirectory(conversationId);
        } catch (Exception e) {
            log.warn("sender_directory_load_failed conversationId={} err={}", conversationId, e.toString());
            directory = SenderDirectory.empty();
        }

        var threadFactory = new CustomizableThreadFactory("conv-sync-" + conversationId + "-");
        threadFactory.setDaemon(true);
        var loop = Executors.newSingleThreadScheduledExecutor(threadFactory);

        return new SyncSession(
                conversationId,
                settings,
                loop,
                fetchExecutor,
                changeFeed,
                fetcher,
                directory,
                clock,
                null
        );
    }
}
