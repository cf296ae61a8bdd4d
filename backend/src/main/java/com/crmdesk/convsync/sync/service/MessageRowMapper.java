package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.MessageRow;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.Optional;

/**
 * Coerces loosely typed change/poll rows into {@link MessageRow}. This is the only place raw payload shapes are
 * interpreted.
 */
public final class MessageRowMapper {

    // "2024-05-01 10:00:00.123456+00" as returned by postgres text output
    private static final DateTimeFormatter SQL_OFFSET = new DateTimeFormatterBuilder()
            .appendPattern("yyyy-MM-dd HH:mm:ss")
            .optionalStart()
            .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
            .optionalEnd()
            .appendPattern("[XXX][XX][X]")
            .toFormatter();

    private MessageRowMapper() {
    }

    public static Optional<MessageRow> map(JsonNode raw) {
        if (raw == null || !raw.isObject()) return Optional.empty();

        var id = textOrNull(raw.get("id"));
        if (id == null || id.isBlank()) return Optional.empty();

        var metadataNode = raw.get("metadata");
        var metadata = (metadataNode != null && metadataNode.isObject()) ? metadataNode : null;

        return Optional.of(new MessageRow(
                id.trim(),
                textOrNull(raw.get("conversation_id")),
                textOrNull(raw.get("text")),
                textOrNull(raw.get("content")),
                textOrNull(raw.get("sender_id")),
                metadata,
                textOrNull(raw.get("reply_to")),
                parseTimestamp(raw.get("created_at")),
                parseTimestamp(raw.get("platform_timestamp"))
        ));
    }

    /** Extracts the id of a delete payload (the old row), or null. */
    public static String idOf(JsonNode raw) {
        if (raw == null || !raw.isObject()) return null;
        var id = textOrNull(raw.get("id"));
        if (id == null || id.isBlank()) return null;
        return id.trim();
    }

    static Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        if (!node.isTextual()) return null;
        return parseTimestamp(node.asText());
    }

    static Instant parseTimestamp(String raw) {
        if (raw == null) return null;
        var s = raw.trim();
        if (s.isEmpty()) return null;

        try {
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException ignore) {
            // try the next shape
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ignore) {
            // try the next shape
        }
        try {
            // timestamp without time zone columns are stored in UTC
            return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignore) {
            // try the next shape
        }
        try {
            var parsed = SQL_OFFSET.parseBest(s, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime odt) return odt.toInstant();
            if (parsed instanceof LocalDateTime ldt) return ldt.toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ignore) {
            // unparseable
        }
        return null;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return null;
        if (node.isContainerNode()) return node.toString();
        return node.asText();
    }
}
