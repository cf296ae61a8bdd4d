package com.crmdesk.convsync.sync.service;

import com.crmdesk.convsync.sync.model.Message;

/**
 * Links a message's {@code reply_to} to the stored message it names.
 */
public final class ThreadResolver {

    private ThreadResolver() {
    }

    /**
     * Returns a copy of {@code message} whose {@code replyToMessage} is the current stored target, or unset when the
     * target is unknown (not arrived yet, or deleted). The linked target carries no link of its own.
     */
    public static Message resolve(Message message, MessageStore store) {
        if (message == null) return null;
        var replyTo = message.replyTo();
        if (replyTo == null || replyTo.isBlank() || replyTo.equals(message.id())) {
            return message.replyToMessage() == null ? message : message.withReplyToMessage(null);
        }
        var target = store.lookup(replyTo)
                .map(m -> m.replyToMessage() == null ? m : m.withReplyToMessage(null))
                .orElse(null);
        return message.withReplyToMessage(target);
    }
}
