package com.roomrank.roomrank_api.model;

public enum ApplicationStatus {
    CONFIRMED,
    CANCELED
}
