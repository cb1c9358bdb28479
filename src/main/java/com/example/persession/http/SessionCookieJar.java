package com.example.persession.http;

import com.example.persession.models.StoredCookie;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.CookieStore;
import java.net.HttpCookie;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Adapts the JDK cookie store to Spring's header types and to the persisted
 * {@link StoredCookie} form.
 *
 * Every cookie is remembered together with the URL that set it and the time it
 * arrived. The URL is what lets a restored cookie from a dotless host such as
 * {@code localhost} match again, and the arrival time turns a max-age into an
 * absolute expiry.
 */
public class SessionCookieJar {
    private static final Logger log = LoggerFactory.getLogger(SessionCookieJar.class);

    private final Clock clock;
    private final Map<HttpCookie, Origin> origins = new ConcurrentHashMap<>();
    private final CookieManager cookieManager;

    public SessionCookieJar() {
        this(Clock.systemUTC());
    }

    SessionCookieJar(Clock clock) {
        this.clock = clock;
        this.cookieManager = new CookieManager(new TrackingCookieStore(), CookiePolicy.ACCEPT_ORIGINAL_SERVER);
    }

    /**
     * Records the Set-Cookie headers of a response received from {@code uri}.
     */
    public void store(URI uri, HttpHeaders responseHeaders) {
        if (!responseHeaders.containsKey(HttpHeaders.SET_COOKIE)) {
            return;
        }
        try {
            cookieManager.put(uri, responseHeaders);
        } catch (IOException e) {
            // CookieManager only throws for null arguments, which cannot happen here
            throw new IllegalStateException("Failed to store cookies from " + uri, e);
        }
    }

    /**
     * @return the value of the Cookie header for a request to {@code uri}, or null if no
     * stored cookie applies
     */
    public String cookieHeader(URI uri) {
        URI target = StringUtils.isEmpty(uri.getPath()) ? uri.resolve("/") : uri;
        List<String> cookies;
        try {
            cookies = cookieManager.get(target, Map.of()).getOrDefault("Cookie", List.of());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read cookies for " + uri, e);
        }
        return cookies.isEmpty() ? null : String.join("; ", cookies);
    }

    /**
     * @return the live cookies; expired cookies are dropped
     */
    public List<HttpCookie> getCookies() {
        return cookieManager.getCookieStore().getCookies();
    }

    public List<StoredCookie> snapshot() {
        List<HttpCookie> live = getCookies();
        origins.keySet().retainAll(live);
        return live.stream()
                .map(cookie -> {
                    Origin origin = origins.get(cookie);
                    return origin != null
                            ? StoredCookie.from(cookie, origin.uri, origin.receivedAt)
                            : StoredCookie.from(cookie, null, clock.instant());
                })
                .collect(Collectors.toList());
    }

    /**
     * Replaces the jar's contents with {@code cookies}. Cookies that expired while
     * stored are skipped; the others keep the time they had left.
     */
    public void restore(List<StoredCookie> cookies) {
        CookieStore cookieStore = cookieManager.getCookieStore();
        cookieStore.removeAll();
        Instant now = clock.instant();
        int restored = 0;
        for (StoredCookie stored : cookies) {
            if (stored.isExpired(now)) {
                log.debug("Dropping expired cookie {}", stored.getName());
                continue;
            }
            cookieStore.add(stored.origin(), stored.toHttpCookie(now));
            restored++;
        }
        log.debug("Restored {} of {} cookies", restored, cookies.size());
    }

    private static final class Origin {
        private final URI uri;
        private final Instant receivedAt;

        private Origin(URI uri, Instant receivedAt) {
            this.uri = uri;
            this.receivedAt = receivedAt;
        }
    }

    /**
     * The JDK's in-memory store, with each added cookie's origin recorded on the way in.
     */
    private final class TrackingCookieStore implements CookieStore {
        private final CookieStore delegate = new CookieManager().getCookieStore();

        @Override
        public void add(URI uri, HttpCookie cookie) {
            // Sent back as plain name=value pairs whatever the Set-Cookie syntax was
            cookie.setVersion(0);
            delegate.add(uri, cookie);
            if (cookie.getMaxAge() == 0) {
                origins.remove(cookie);
            } else {
                origins.put(cookie, new Origin(uri, clock.instant()));
            }
        }

        @Override
        public List<HttpCookie> get(URI uri) {
            return delegate.get(uri);
        }

        @Override
        public List<HttpCookie> getCookies() {
            return delegate.getCookies();
        }

        @Override
        public List<URI> getURIs() {
            return delegate.getURIs();
        }

        @Override
        public boolean remove(URI uri, HttpCookie cookie) {
            origins.remove(cookie);
            return delegate.remove(uri, cookie);
        }

        @Override
        public boolean removeAll() {
            origins.clear();
            return delegate.removeAll();
        }
    }
}
