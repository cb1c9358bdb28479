package com.example.persession;

import com.example.persession.http.SessionCookieJar;
import com.example.persession.models.CacheType;
import com.example.persession.models.SessionState;
import org.springframework.http.HttpHeaders;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The mutable state behind a {@link PersistentSession}. Kept apart from the session
 * object so the exit hook can save it without holding a reference to the session.
 */
final class SessionContext {
    final SessionCookieJar cookieJar = new SessionCookieJar();
    final HttpHeaders headers = new HttpHeaders();
    final Map<String, String> proxies = new LinkedHashMap<>();
    final Path cacheFilePath;
    Duration cacheTimeout;
    CacheType cacheType;

    SessionContext(Path cacheFilePath, Duration cacheTimeout, CacheType cacheType) {
        this.cacheFilePath = cacheFilePath;
        this.cacheTimeout = cacheTimeout;
        this.cacheType = cacheType;
    }

    Map<String, String> getProxies() {
        return proxies;
    }

    SessionState snapshot() {
        SessionState state = new SessionState();
        state.setCookies(cookieJar.snapshot());
        Map<String, List<String>> headerCopy = new LinkedHashMap<>();
        headers.forEach((name, values) -> headerCopy.put(name, new ArrayList<>(values)));
        state.setHeaders(headerCopy);
        state.setProxies(new LinkedHashMap<>(proxies));
        state.setCacheFilePath(cacheFilePath.toString());
        state.setCacheTimeout(cacheTimeout);
        state.setCacheType(cacheType);
        return state;
    }

    /**
     * Replaces cookies, headers, proxies and cache settings with those of {@code state}.
     * The cache file path stays the one the state was read from.
     */
    void adopt(SessionState state) {
        cookieJar.restore(state.getCookies());
        headers.clear();
        state.getHeaders().forEach((name, values) -> headers.put(name, new ArrayList<>(values)));
        proxies.clear();
        proxies.putAll(state.getProxies());
        cacheTimeout = state.getCacheTimeout();
        cacheType = state.getCacheType();
    }
}
