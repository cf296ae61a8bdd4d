package com.crmdesk.convsync.sync.model;

import java.util.Locale;

public enum ChangeKind {
    INSERT,
    UPDATE,
    DELETE;

    public static ChangeKind parse(String raw) {
        if (raw == null) return null;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "INSERT" -> INSERT;
            case "UPDATE" -> UPDATE;
            case "DELETE" -> DELETE;
            default -> null;
        };
    }
}
