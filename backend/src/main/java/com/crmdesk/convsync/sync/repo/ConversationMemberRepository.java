package com.crmdesk.convsync.sync.repo;

import com.crmdesk.convsync.sync.service.SenderDirectory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;

@Repository
public class ConversationMemberRepository {

    public record MemberRow(String id, String conversationId, String externalId, String name) {
    }

    private final JdbcTemplate jdbcTemplate;

    public ConversationMemberRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<MemberRow> listByConversation(String conversationId) {
        var sql = """
                select id, conversation_id, external_id, name
                from conversation_members
                where conversation_id = ?
                order by created_at asc
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> new MemberRow(
                rs.getString("id"),
                rs.getString("conversation_id"),
                rs.getString("external_id"),
                rs.getString("name")
        ), conversationId);
    }

    /**
     * Snapshot directory for one conversation. Senders are matched by external id (the platform sender id) and by
     * member id; the first non-blank name wins.
     */
    public SenderDirectory loadDirectory(String conversationId) {
        var names = new HashMap<String, String>();
        for (var m : listByConversation(conversationId)) {
            if (m.name() == null || m.name().isBlank()) continue;
            if (m.externalId() != null && !m.externalId().isBlank()) {
                names.putIfAbsent(m.externalId(), m.name());
            }
            if (m.id() != null) {
                names.putIfAbsent(m.id(), m.name());
            }
        }
        return SenderDirectory.of(names);
    }
}
