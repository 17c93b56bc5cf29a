package com.my.relay.domain.model;

public enum RelayEventType {
    NOTICE,
    PROGRESS,
    BACKOFF,
    REJECTED,
    CANCELLED,
    COMPLETED
}
