package com.crmdesk.convsync.sync.repo;

import com.crmdesk.convsync.sync.service.MessageFetcher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Polling source over the hosted {@code messages} table. Rows are handed out as raw JSON so that polled and pushed
 * rows go through the same coercion.
 */
@Repository
public class MessageRepository implements MessageFetcher {

    private static final Logger log = LoggerFactory.getLogger(MessageRepository.class);

    private static final String COLUMNS =
            "id, conversation_id, text, content, sender_id, metadata, reply_to, platform_timestamp, created_at";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final int fetchLimit;

    public MessageRepository(
            JdbcTemplate jdbcTemplate,
            ObjectMapper objectMapper,
            @Value("${app.sync.fetch-limit:100}") int fetchLimit
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.fetchLimit = Math.max(1, Math.min(fetchLimit, 1000));
    }

    @Override
    public List<JsonNode> fetchSince(String conversationId, Instant watermark) {
        if (conversationId == null || conversationId.isBlank()) return List.of();

        if (watermark == null) {
            var sql = "select " + COLUMNS + """
                     from messages
                    where conversation_id = ?
                    order by created_at desc
                    limit ?
                    """;
            var latest = new ArrayList<>(jdbcTemplate.query(sql, (rs, rowNum) -> toJson(rs), conversationId, fetchLimit));
            Collections.reverse(latest);
            return latest;
        }

        var sql = "select " + COLUMNS + """
                 from messages
                where conversation_id = ? and created_at > ?
                order by created_at asc
                limit ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> toJson(rs), conversationId, Timestamp.from(watermark), fetchLimit);
    }

    private JsonNode toJson(ResultSet rs) throws SQLException {
        ObjectNode row = objectMapper.createObjectNode();
        row.put("id", rs.getString("id"));
        row.put("conversation_id", rs.getString("conversation_id"));
        putIfNotNull(row, "text", rs.getString("text"));
        putIfNotNull(row, "content", rs.getString("content"));
        putIfNotNull(row, "sender_id", rs.getString("sender_id"));
        putIfNotNull(row, "reply_to", rs.getString("reply_to"));

        var metadataJson = rs.getString("metadata");
        if (metadataJson != null && !metadataJson.isBlank()) {
            try {
                row.set("metadata", objectMapper.readTree(metadataJson));
            } catch (Exception e) {
                log.debug("message_metadata_unreadable id={} err={}", rs.getString("id"), e.toString());
            }
        }

        var platformTs = rs.getTimestamp("platform_timestamp");
        if (platformTs != null) {
            row.put("platform_timestamp", platformTs.toInstant().toString());
        }
        var createdAt = rs.getTimestamp("created_at");
        if (createdAt != null) {
            row.put("created_at", createdAt.toInstant().toString());
        }
        return row;
    }

    private static void putIfNotNull(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
