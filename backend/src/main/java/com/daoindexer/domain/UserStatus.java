package com.daoindexer.domain;

public enum UserStatus {
    MODERATION,
    ACTIVE,
    BANNED
}
