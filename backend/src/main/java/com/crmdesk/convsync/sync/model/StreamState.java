package com.crmdesk.convsync.sync.model;

public enum StreamState {
    INIT,
    SUBSCRIBING,
    SUBSCRIBED,
    ERROR,
    CLOSED
}
