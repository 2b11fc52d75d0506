package com.roomrank.roomrank_api.model;

// OPEN → CLOSED (rooms created) or CANCELED (not enough applicants); both terminal
public enum PoolStatus {
    OPEN,
    CLOSED,
    CANCELED
}
