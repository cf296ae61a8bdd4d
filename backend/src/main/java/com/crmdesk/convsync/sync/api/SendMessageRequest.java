package com.crmdesk.convsync.sync.api;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SendMessageRequest(
        @NotBlank(message = "missing_text") @Size(max = 10000, message = "text_too_long") String text,
        String reply_to,
        String sender,
        JsonNode metadata
) {
}
