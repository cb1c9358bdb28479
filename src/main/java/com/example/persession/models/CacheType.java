package com.example.persession.models;

/**
 * Selects which events cause a session to be written to its cache file.
 * Exactly one value is active per session and it never changes after construction.
 */
public enum CacheType {
    /** Only explicit {@code cacheSession()} calls write the cache. */
    MANUAL,
    /** Write after every request/response hop. */
    AFTER_EACH_REQUEST,
    /** Write after every POST hop. */
    AFTER_EACH_POST,
    /** Write after each login that is classified as successful. */
    AFTER_EACH_LOGIN,
    /**
     * Write when the session is closed. Use try-with-resources: the garbage collection
     * fallback is not guaranteed to run before the JVM exits.
     */
    AT_EXIT
}
