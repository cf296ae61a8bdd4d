package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.repo.ConversationMemberRepository;
import com.crmdesk.convsync.sync.ws.FakeChangeFeed;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncSessionRegistryTest {

    private ExecutorService fetchExecutor;
    private ConversationMemberRepository members;
    private FakeChangeFeed feed;
    private SyncSessionRegistry registry;

    @BeforeEach
    void setUp() {
        fetchExecutor = Executors.newFixedThreadPool(2);
        members = mock(ConversationMemberRepository.class);
        feed = new FakeChangeFeed();
        registry = new SyncSessionRegistry(
                feed,
                (conversationId, watermark) -> List.of(),
                members,
                fetchExecutor,
                Clock.systemUTC(),
                "messages",
                60_000
        );
    }

    @AfterEach
    void tearDown() {
        registry.closeAll();
        fetchExecutor.shutdownNow();
    }

    @Test
    void open_is_idempotent_per_conversation() {
        when(members.loadDirectory("conv_1")).thenReturn(SenderDirectory.empty());

        var first = registry.open("conv_1");
        var second = registry.open("conv_1");

        assertThat(second).isSameAs(first);
        assertThat(registry.openCount()).isEqualTo(1);
        assertThat(feed.listeners).hasSize(1);
    }

    @Test
    void blank_conversation_is_rejected() {
        assertThatThrownBy(() -> registry.open(" ")).hasMessage("missing_conversation_id");
    }

    @Test
    void directory_is_loaded_without_holding_the_session_map() {
        var otherCallFinished = new AtomicBoolean();
        when(members.loadDirectory("conv_1")).thenAnswer(inv -> {
            // another caller touching the same key must not block on this load
            CompletableFuture.runAsync(() -> registry.close("conv_1")).get(1, TimeUnit.SECONDS);
            otherCallFinished.set(true);
            return SenderDirectory.of(Map.of("+4915112345", "Alice"));
        });

        var session = registry.open("conv_1");

        assertThat(otherCallFinished).isTrue();
        assertThat(registry.find("conv_1")).containsSame(session);
    }

    @Test
    void directory_failure_falls_back_to_empty() {
        when(members.loadDirectory("conv_1")).thenThrow(new IllegalStateException("db down"));

        var session = registry.open("conv_1");

        assertThat(session.isClosed()).isFalse();
        assertThat(registry.find("conv_1")).isPresent();
    }

    @Test
    void close_removes_and_stops_the_session() {
        when(members.loadDirectory("conv_1")).thenReturn(SenderDirectory.empty());
        var session = registry.open("conv_1");

        assertThat(registry.close("conv_1")).isTrue();
        assertThat(registry.close("conv_1")).isFalse();
        assertThat(session.isClosed()).isTrue();
        assertThat(registry.find("conv_1")).isEmpty();
    }

    @Test
    void reopening_after_close_builds_a_fresh_session() {
        when(members.loadDirectory("conv_1")).thenReturn(SenderDirectory.empty());
        var first = registry.open("conv_1");
        registry.close("conv_1");

        var second = registry.open("conv_1");

        assertThat(second).isNotSameAs(first);
        assertThat(second.isClosed()).isFalse();
    }
}
