package com.roomrank.roomrank_api.model;

public enum MemberStatus {
    CONFIRMED,
    WITHDRAWN
}
