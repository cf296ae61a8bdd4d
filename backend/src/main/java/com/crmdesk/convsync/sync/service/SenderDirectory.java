package com.crmdesk.convsync.sync.service;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of conversation members by sender id. Supplied by the caller; the engine never mutates it.
 */
public interface SenderDirectory {

    Optional<String> displayName(String senderId);

    static SenderDirectory empty() {
        return senderId -> Optional.empty();
    }

    static SenderDirectory of(Map<String, String> namesBySenderId) {
        var copy = Map.copyOf(namesBySenderId);
        return senderId -> {
            if (senderId == null) return Optional.empty();
            var name = copy.get(senderId);
            return (name == null || name.isBlank()) ? Optional.empty() : Optional.of(name);
        };
    }
}
