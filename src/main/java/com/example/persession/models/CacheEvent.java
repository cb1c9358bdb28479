package com.example.persession.models;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Something that happened to a session which may warrant writing its cache.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CacheEvent {

    public enum Kind {
        REQUEST_SENT,
        LOGIN_SUCCEEDED,
        SCOPE_EXIT
    }

    private static final CacheEvent LOGIN_SUCCEEDED = new CacheEvent(Kind.LOGIN_SUCCEEDED, null);
    private static final CacheEvent SCOPE_EXIT = new CacheEvent(Kind.SCOPE_EXIT, null);

    private final Kind kind;
    // Only set for REQUEST_SENT
    private final String method;

    private CacheEvent(Kind kind, String method) {
        this.kind = kind;
        this.method = method;
    }

    public static CacheEvent requestSent(String method) {
        return new CacheEvent(Kind.REQUEST_SENT, method);
    }

    public static CacheEvent loginSucceeded() {
        return LOGIN_SUCCEEDED;
    }

    public static CacheEvent scopeExit() {
        return SCOPE_EXIT;
    }
}
