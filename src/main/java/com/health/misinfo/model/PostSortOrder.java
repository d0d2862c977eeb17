package com.health.misinfo.model;

public enum PostSortOrder {
    TIMESTAMP,
    SCORE,
    SHARES
}
