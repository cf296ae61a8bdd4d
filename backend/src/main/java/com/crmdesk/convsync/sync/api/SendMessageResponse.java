package com.crmdesk.convsync.sync.api;

public record SendMessageResponse(String message_id) {
}
