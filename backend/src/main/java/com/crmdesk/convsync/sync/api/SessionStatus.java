package com.crmdesk.convsync.sync.api;

import com.crmdesk.convsync.sync.service.SyncSession;

public record SessionStatus(
        String conversation_id,
        String stream_state,
        boolean polling,
        int message_count
) {
    public static SessionStatus of(SyncSession session) {
        return new SessionStatus(
                session.conversationId(),
                session.streamState().name(),
                session.isPolling(),
                session.messages().size()
        );
    }
}
